package com.yamltest.service.diff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.yamltest.service.compare.JsonValues;
import jakarta.inject.Singleton;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Renders differences as a bullet list:
 *   • path: lhs => rhs
 *   • path: Added x
 *   • path: Removed x
 * Arrays that changed length are shown as YAML before/after blocks, and every
 * difference nested under such an array is folded into that block.
 */
@Singleton
public class DiffFormatter {

    private final YAMLMapper yaml = new YAMLMapper(YAMLFactory.builder()
        .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
        .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
        .build());

    public String format(List<Difference> differences) {
        StringBuilder out = new StringBuilder();
        Set<String> arrays = new LinkedHashSet<>();

        for (Difference d : differences) {
            String path = d.pathString();
            String label = path.isEmpty() ? "(root)" : path;
            if (d.kind() == Difference.Kind.ARRAY) {
                if (arrays.add(path)) {
                    out.append("• ").append(label).append(":\n\n")
                        .append("Before:\n").append(toYaml(d.lhs())).append('\n')
                        .append("After:\n").append(toYaml(d.rhs())).append("\n\n");
                }
                continue;
            }
            if (arrays.stream().anyMatch(a -> isUnder(path, a))) {
                continue;
            }
            switch (d.kind()) {
                case EDITED -> out.append("• ").append(label).append(": ")
                    .append(JsonValues.toJson(d.lhs())).append(" => ").append(JsonValues.toJson(d.rhs())).append('\n');
                case NEW -> out.append("• ").append(label).append(": Added ").append(JsonValues.toJson(d.rhs())).append('\n');
                case DELETED -> out.append("• ").append(label).append(": Removed ").append(JsonValues.toJson(d.lhs())).append('\n');
                default -> out.append("• ").append(label).append(": Changed\n");
            }
        }
        return out.toString();
    }

    private static boolean isUnder(String path, String arrayPath) {
        return arrayPath.isEmpty() || path.equals(arrayPath) || path.startsWith(arrayPath + ".");
    }

    private String toYaml(JsonNode node) {
        try {
            return yaml.writeValueAsString(node).trim();
        } catch (JsonProcessingException e) {
            return JsonValues.toJson(node);
        }
    }
}
