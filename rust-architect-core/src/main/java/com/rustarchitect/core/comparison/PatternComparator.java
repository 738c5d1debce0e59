package com.rustarchitect.core.comparison;

import com.rustarchitect.core.model.ArchitectureModel;
import com.rustarchitect.core.model.CommunicationPattern;
import com.rustarchitect.core.model.Detection;
import com.rustarchitect.core.model.PatternComparison;
import com.rustarchitect.core.model.PatternComparison.ProjectPatterns;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Cross-references the detections of several analysed projects.
 */
public class PatternComparator {

    public PatternComparison compare(List<ArchitectureModel> models) {
        Objects.requireNonNull(models, "models must not be null");

        List<ProjectPatterns> projects = new ArrayList<>();
        TreeSet<String> allStyles = new TreeSet<>();
        TreeSet<String> allPatterns = new TreeSet<>();
        TreeSet<String> allCommunication = new TreeSet<>();

        for (ArchitectureModel model : models) {
            List<String> communication = model.communicationPatterns().stream()
                .map(CommunicationPattern::name)
                .toList();
            projects.add(new ProjectPatterns(
                model.project(),
                model.architectureStyles(),
                model.designPatterns(),
                communication,
                Math.max(1, model.manifest().packageCount())
            ));
            model.architectureStyles().stream().map(Detection::name).forEach(allStyles::add);
            model.designPatterns().stream().map(Detection::name).forEach(allPatterns::add);
            allCommunication.addAll(communication);
        }

        return new PatternComparison(
            projects,
            new ArrayList<>(allStyles),
            new ArrayList<>(allPatterns),
            new ArrayList<>(allCommunication)
        );
    }
}
