package com.rustarchitect.core.index;

import com.rustarchitect.core.model.DomainModel;
import com.rustarchitect.core.scanner.SourceFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the public domain types of a project: structs with their fields, enums with
 * their variants, type aliases with their targets, and traits.
 *
 * <p>Only bare {@code pub} declarations count. Struct and enum bodies are taken up to the
 * matching closing brace and split on top-level commas, so nested generics, tuple
 * variants and struct variants do not produce extra members. Comments and attributes
 * inside a body are ignored. Tuple and unit structs have no braced body and are skipped.
 */
public class DomainModelAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(DomainModelAnalyzer.class);

    private static final String GENERICS = "(?:\\s*<(?:[^<>]|<[^<>]*>)*>)?";
    private static final String WHERE_CLAUSE = "(?:\\s*where\\b[^{;]*)?";

    private static final Pattern STRUCT = Pattern.compile(
        "\\bpub\\s+struct\\s+(\\w+)" + GENERICS + WHERE_CLAUSE + "\\s*\\{");
    private static final Pattern ENUM = Pattern.compile(
        "\\bpub\\s+enum\\s+(\\w+)" + GENERICS + WHERE_CLAUSE + "\\s*\\{");
    private static final Pattern TYPE_ALIAS = Pattern.compile(
        "\\bpub\\s+type\\s+(\\w+)" + GENERICS + "\\s*=\\s*([^;]+);");
    private static final Pattern TRAIT = Pattern.compile(
        "\\bpub\\s+(?:unsafe\\s+)?trait\\s+(\\w+)");

    private static final Pattern FIELD = Pattern.compile("^(?:pub(?:\\s*\\([^)]*\\))?\\s+)?(\\w+)\\s*:(?!:)");
    private static final Pattern VARIANT = Pattern.compile("^([A-Za-z_]\\w*)");
    private static final Pattern LINE_COMMENT = Pattern.compile("//[^\\n]*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("(?s)/\\*.*?\\*/");
    private static final Pattern ATTRIBUTE = Pattern.compile("#!?\\[[^\\]]*\\]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public DomainModel analyze(List<SourceFile> files) {
        Objects.requireNonNull(files, "files must not be null");

        List<DomainModel.StructType> structs = new ArrayList<>();
        List<DomainModel.EnumType> enums = new ArrayList<>();
        List<DomainModel.TypeAlias> aliases = new ArrayList<>();
        List<DomainModel.TraitType> traits = new ArrayList<>();

        for (SourceFile file : files) {
            String content = file.content();

            Matcher struct = STRUCT.matcher(content);
            while (struct.find()) {
                List<String> fields = members(body(content, struct.end()), FIELD);
                structs.add(new DomainModel.StructType(struct.group(1), fields, file.path()));
            }

            Matcher enumMatcher = ENUM.matcher(content);
            while (enumMatcher.find()) {
                List<String> variants = members(body(content, enumMatcher.end()), VARIANT);
                enums.add(new DomainModel.EnumType(enumMatcher.group(1), variants, file.path()));
            }

            Matcher alias = TYPE_ALIAS.matcher(content);
            while (alias.find()) {
                aliases.add(new DomainModel.TypeAlias(alias.group(1), target(alias.group(2)), file.path()));
            }

            Matcher trait = TRAIT.matcher(content);
            while (trait.find()) {
                traits.add(new DomainModel.TraitType(trait.group(1), file.path()));
            }
        }

        log.debug("Found {} structs, {} enums, {} type aliases, {} traits",
            structs.size(), enums.size(), aliases.size(), traits.size());
        return new DomainModel(structs, enums, aliases, traits);
    }

    /**
     * Returns the text between an opening brace (ending at {@code start}) and its
     * matching closing brace, or the rest of the text when it is never closed.
     */
    static String body(String content, int start) {
        int depth = 1;
        for (int i = start; i < content.length(); i++) {
            char c = content.charAt(i);
            if (c == '{') {
                depth++;
            } else if (c == '}' && --depth == 0) {
                return content.substring(start, i);
            }
        }
        return content.substring(start);
    }

    /**
     * Splits a body on commas outside any bracket pair. The {@code >} of {@code ->} and
     * {@code =>} does not close a bracket.
     */
    static List<String> splitTopLevel(String body) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int partStart = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            switch (c) {
                case '(', '[', '{', '<' -> depth++;
                case ')', ']', '}' -> depth = Math.max(0, depth - 1);
                case '>' -> {
                    char previous = i > 0 ? body.charAt(i - 1) : ' ';
                    if (previous != '-' && previous != '=') {
                        depth = Math.max(0, depth - 1);
                    }
                }
                case ',' -> {
                    if (depth == 0) {
                        parts.add(body.substring(partStart, i));
                        partStart = i + 1;
                    }
                }
                default -> {
                }
            }
        }
        parts.add(body.substring(partStart));
        return parts;
    }

    private static List<String> members(String body, Pattern member) {
        String cleaned = ATTRIBUTE.matcher(
            LINE_COMMENT.matcher(BLOCK_COMMENT.matcher(body).replaceAll(" ")).replaceAll("")).replaceAll(" ");
        List<String> names = new ArrayList<>();
        for (String part : splitTopLevel(cleaned)) {
            Matcher matcher = member.matcher(part.strip());
            if (matcher.find()) {
                names.add(matcher.group(1));
                if (names.size() == DomainModel.MEMBER_LIMIT) {
                    break;
                }
            }
        }
        return names;
    }

    private static String target(String raw) {
        String target = WHITESPACE.matcher(raw.strip()).replaceAll(" ");
        return target.length() > DomainModel.TARGET_LIMIT
            ? target.substring(0, DomainModel.TARGET_LIMIT)
            : target;
    }
}
