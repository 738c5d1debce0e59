package com.rustarchitect.core.detector;

import com.rustarchitect.core.config.AnalysisConfig;
import com.rustarchitect.core.extractor.RustPatterns;
import com.rustarchitect.core.model.CommunicationPattern;
import com.rustarchitect.core.model.Detection;
import com.rustarchitect.core.model.Evidence;
import com.rustarchitect.core.model.Manifest;
import com.rustarchitect.core.model.Signature;
import com.rustarchitect.core.model.SignatureCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scores signatures against aggregated source text.
 *
 * <p>Each piece of evidence adds its weight to the maximum score; matched evidence adds
 * the same weight to the score. Keywords, patterns and traits are searched in the corpus.
 * An import matches when the manifest text contains it or the corpus contains
 * {@code use <import>}. {@code confidence = score / maxScore}; a signature without
 * evidence or without a single hit never produces a detection.
 *
 * <p>Architecture styles additionally get two workspace-shape heuristics that bypass the
 * scorer: {@value #MULTI_CRATE_WORKSPACE} at {@value #WORKSPACE_CONFIDENCE} and
 * {@value #MODULAR_MONOLITH} at {@value #MONOLITH_CONFIDENCE}.
 *
 * <p>Results are sorted by confidence, highest first. Ties keep catalog order.
 */
public class PatternDetector {

    public static final String MULTI_CRATE_WORKSPACE = "Multi-Crate Workspace";
    public static final String MODULAR_MONOLITH = "Modular Monolith";
    public static final double WORKSPACE_CONFIDENCE = 0.9;
    public static final double MONOLITH_CONFIDENCE = 0.7;

    private static final Logger log = LoggerFactory.getLogger(PatternDetector.class);
    private static final Set<String> HEURISTIC_STYLES = Set.of(MULTI_CRATE_WORKSPACE, MODULAR_MONOLITH);
    private static final Comparator<Detection> BY_CONFIDENCE =
        Comparator.comparingDouble(Detection::confidence).reversed();

    private final AnalysisConfig.DetectionConfig config;
    private final Map<String, Pattern> compiledPatterns = new ConcurrentHashMap<>();

    public PatternDetector() {
        this(AnalysisConfig.DetectionConfig.defaults());
    }

    public PatternDetector(AnalysisConfig.DetectionConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Scores every signature of a catalog with the design-pattern threshold.
     *
     * @param corpus production source text
     * @param manifest manifest text, may be empty
     * @param catalog signatures to score
     * @return detections at or above the threshold, confidence descending
     */
    public List<Detection> detectSignatures(String corpus, String manifest, SignatureCatalog catalog) {
        Objects.requireNonNull(corpus, "corpus must not be null");
        Objects.requireNonNull(manifest, "manifest must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");

        List<Detection> detected = new ArrayList<>();
        for (Signature signature : catalog.signatures()) {
            scoreSafely(signature, corpus, manifest, config.patternThreshold()).ifPresent(detected::add);
        }
        detected.sort(BY_CONFIDENCE);
        log.debug("Catalog {}: {} of {} signatures detected",
            catalog.id(), detected.size(), catalog.signatures().size());
        return detected;
    }

    /**
     * Detects architecture styles.
     *
     * <p>A workspace with more packages than the workspace threshold is a multi-crate
     * workspace; otherwise a non-workspace project with more module declarations than the
     * monolith threshold is a modular monolith. All other catalog styles are scored on
     * corpus followed by manifest text with the style threshold.
     *
     * @param corpus production source text
     * @param manifest manifest metadata
     * @param catalog style signatures
     * @return detections, confidence descending
     */
    public List<Detection> detectArchitectureStyles(String corpus, Manifest manifest, SignatureCatalog catalog) {
        Objects.requireNonNull(corpus, "corpus must not be null");
        Objects.requireNonNull(manifest, "manifest must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");

        List<Detection> detected = new ArrayList<>();

        if (manifest.isWorkspace() && manifest.packageCount() > config.workspacePackageThreshold()) {
            detected.add(new Detection(
                MULTI_CRATE_WORKSPACE,
                WORKSPACE_CONFIDENCE,
                List.of("Workspace with " + manifest.packageCount() + " packages"),
                descriptionOf(catalog, MULTI_CRATE_WORKSPACE)
            ));
        } else if (!manifest.isWorkspace()) {
            int moduleCount = countModuleDeclarations(corpus);
            if (moduleCount > config.monolithModuleThreshold()) {
                detected.add(new Detection(
                    MODULAR_MONOLITH,
                    MONOLITH_CONFIDENCE,
                    List.of("Single crate with " + moduleCount + "+ module declarations"),
                    descriptionOf(catalog, MODULAR_MONOLITH)
                ));
            }
        }

        String combined = corpus + manifest.rawText();
        for (Signature signature : catalog.signatures()) {
            if (HEURISTIC_STYLES.contains(signature.name())) {
                continue;
            }
            scoreSafely(signature, combined, combined, config.styleThreshold()).ifPresent(detected::add);
        }

        detected.sort(BY_CONFIDENCE);
        log.debug("Detected {} architecture styles", detected.size());
        return detected;
    }

    /**
     * Detects communication patterns. A pattern is reported when at least one of its
     * markers occurs in corpus or manifest text; its usage count is the total number of
     * occurrences of the markers found.
     *
     * @param corpus production source text
     * @param manifest manifest text, may be empty
     * @param catalog marker lists, one signature per pattern
     * @return patterns, usage count descending
     */
    public List<CommunicationPattern> detectCommunicationPatterns(String corpus, String manifest,
                                                                  SignatureCatalog catalog) {
        Objects.requireNonNull(corpus, "corpus must not be null");
        Objects.requireNonNull(manifest, "manifest must not be null");
        Objects.requireNonNull(catalog, "catalog must not be null");

        String combined = corpus + manifest;
        List<CommunicationPattern> detected = new ArrayList<>();
        for (Signature signature : catalog.signatures()) {
            List<String> found = new ArrayList<>();
            int usage = 0;
            for (Evidence marker : signature.evidence()) {
                int occurrences = countOccurrences(combined, marker.value());
                if (occurrences > 0) {
                    found.add(marker.value());
                    usage += occurrences;
                }
            }
            if (!found.isEmpty()) {
                detected.add(new CommunicationPattern(signature.name(), found, usage));
            }
        }
        detected.sort(Comparator.comparingInt(CommunicationPattern::usageCount).reversed());
        return detected;
    }

    /**
     * Scores one signature.
     *
     * @param signature signature to score
     * @param corpus text searched for keywords, patterns and traits
     * @param manifest text searched for imports
     * @param threshold minimum confidence
     * @return detection when there is at least one hit and confidence reaches the threshold
     */
    public Optional<Detection> score(Signature signature, String corpus, String manifest, double threshold) {
        int score = 0;
        int maxScore = 0;
        List<String> evidence = new ArrayList<>();

        for (Evidence item : signature.evidence()) {
            maxScore += item.weight();
            if (isPresent(item, corpus, manifest)) {
                score += item.weight();
                evidence.add(item.describe());
            }
        }

        if (maxScore == 0 || score == 0) {
            return Optional.empty();
        }

        double confidence = Math.min((double) score / maxScore, 1.0);
        log.debug("Signature '{}' scored {}/{} ({})", signature.name(), score, maxScore, confidence);
        if (confidence < threshold) {
            return Optional.empty();
        }
        return Optional.of(new Detection(signature.name(), confidence, evidence, signature.description()));
    }

    private Optional<Detection> scoreSafely(Signature signature, String corpus, String manifest, double threshold) {
        try {
            return score(signature, corpus, manifest, threshold);
        } catch (RuntimeException e) {
            log.warn("Skipping signature '{}': {}", signature.name(), e.getMessage());
            return Optional.empty();
        }
    }

    private boolean isPresent(Evidence item, String corpus, String manifest) {
        return switch (item.kind()) {
            case KEYWORD, TRAIT -> corpus.contains(item.value());
            case IMPORT -> manifest.contains(item.value()) || corpus.contains("use " + item.value());
            case PATTERN -> compiledPatterns.computeIfAbsent(item.value(), Pattern::compile).matcher(corpus).find();
        };
    }

    private static int countModuleDeclarations(String corpus) {
        Matcher matcher = RustPatterns.CONTAINS.matcher(corpus);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }

    private static int countOccurrences(String text, String marker) {
        int count = 0;
        int from = text.indexOf(marker);
        while (from >= 0) {
            count++;
            from = text.indexOf(marker, from + marker.length());
        }
        return count;
    }

    private static String descriptionOf(SignatureCatalog catalog, String name) {
        return catalog.find(name).map(Signature::description).orElse(null);
    }
}
