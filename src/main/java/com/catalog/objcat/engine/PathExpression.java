package com.catalog.objcat.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.catalog.objcat.api.LookupException;
import com.catalog.objcat.node.CatalogNode;
import com.catalog.objcat.node.Field;
import com.catalog.objcat.node.FieldNode;

/**
 * Parsed tree path pointing at a field, relative to a starting node.
 *
 * <pre>
 * path      := step* fieldName
 * step      := '^'             parent
 *            | '^(' name ')'   nearest strict ancestor matching name
 *            | '.'             first child
 *            | '.(' index ')'  child at index, negative counts from the end
 *            | '.(' name ')'   first child matching name
 * </pre>
 *
 * A path with no steps names a field on the starting node itself.
 */
public final class PathExpression {

    public enum StepKind {
        PARENT, ANCESTOR, FIRST_CHILD, CHILD_AT, CHILD_NAMED
    }

    public record Step(StepKind kind, String qualifier) {
        public Step {
            if (kind == StepKind.CHILD_AT) {
                try {
                    Integer.parseInt(qualifier);
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Child index " + qualifier + " is not a valid int", e);
                }
            }
        }

        /** Child index of a {@code CHILD_AT} step. */
        public int index() {
            return Integer.parseInt(qualifier);
        }

        @Override
        public String toString() {
            return switch (kind) {
                case PARENT -> "^";
                case ANCESTOR -> "^(" + qualifier + ")";
                case FIRST_CHILD -> ".";
                case CHILD_AT, CHILD_NAMED -> ".(" + qualifier + ")";
            };
        }
    }

    private final String text;
    private final List<Step> steps;
    private final String fieldName;

    private PathExpression(String text, List<Step> steps, String fieldName) {
        this.text = text;
        this.steps = Collections.unmodifiableList(steps);
        this.fieldName = fieldName;
    }

    /**
     * @throws IllegalArgumentException if {@code text} is not a well formed path
     */
    public static PathExpression parse(String text) {
        Objects.requireNonNull(text, "path");
        List<Step> steps = new ArrayList<>();
        int i = 0;
        int n = text.length();
        while (i < n && (text.charAt(i) == '^' || text.charAt(i) == '.')) {
            boolean up = text.charAt(i) == '^';
            i++;
            if (i < n && text.charAt(i) == '(') {
                int close = text.indexOf(')', i);
                if (close < 0) {
                    throw new IllegalArgumentException("Unclosed qualifier in path \"" + text + "\"");
                }
                String qualifier = text.substring(i + 1, close).strip();
                if (qualifier.isEmpty()) {
                    throw new IllegalArgumentException("Empty qualifier in path \"" + text + "\"");
                }
                if (up) {
                    steps.add(new Step(StepKind.ANCESTOR, qualifier));
                } else if (qualifier.matches("-?\\d+")) {
                    try {
                        steps.add(new Step(StepKind.CHILD_AT, qualifier));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Child index out of range in path \"" + text + "\"", e);
                    }
                } else {
                    steps.add(new Step(StepKind.CHILD_NAMED, qualifier));
                }
                i = close + 1;
            } else {
                steps.add(new Step(up ? StepKind.PARENT : StepKind.FIRST_CHILD, null));
            }
        }
        String field = text.substring(i).strip();
        if (field.isEmpty()) {
            throw new IllegalArgumentException("Improperly formatted field path \"" + text + "\": no field name");
        }
        if (field.indexOf('^') >= 0 || field.indexOf('.') >= 0 || field.indexOf('(') >= 0) {
            throw new IllegalArgumentException("Path steps must precede the field name in \"" + text + "\"");
        }
        return new PathExpression(text, steps, field);
    }

    public String text() {
        return text;
    }

    public List<Step> steps() {
        return steps;
    }

    public String fieldName() {
        return fieldName;
    }

    public boolean isLocal() {
        return steps.isEmpty();
    }

    /** Follows the steps from {@code origin} and returns the node reached. */
    public CatalogNode navigate(CatalogNode origin) {
        CatalogNode node = Objects.requireNonNull(origin, "origin");
        for (Step step : steps) {
            node = apply(step, node);
        }
        return node;
    }

    /** Navigates and returns the named field of the node reached. */
    public Field<?> resolve(CatalogNode origin) {
        CatalogNode target = navigate(origin);
        if (!(target instanceof FieldNode container)) {
            throw new LookupException("Linked node " + target + " has no fields (path \"" + text + "\")");
        }
        if (!container.hasField(fieldName)) {
            throw new LookupException(
                    "Linked node " + container + " does not have requested field \"" + fieldName + "\"");
        }
        return container.field(fieldName);
    }

    private CatalogNode apply(Step step, CatalogNode node) {
        switch (step.kind()) {
            case PARENT: {
                CatalogNode parent = node.parent();
                if (parent == null) {
                    throw new LookupException("No parent above " + node + " (path \"" + text + "\")");
                }
                return parent;
            }
            case ANCESTOR: {
                CatalogNode candidate = node.parent();
                while (candidate != null && !candidate.matches(step.qualifier())) {
                    candidate = candidate.parent();
                }
                if (candidate == null) {
                    throw new LookupException("No parent matching \"" + step.qualifier() + "\" found above " + node);
                }
                return candidate;
            }
            case FIRST_CHILD: {
                if (node.childCount() == 0) {
                    throw new LookupException("No children below " + node + " (path \"" + text + "\")");
                }
                return node.child(0);
            }
            case CHILD_AT: {
                int count = node.childCount();
                int index = step.index();
                int effective = index < 0 ? count + index : index;
                if (effective < 0 || effective >= count) {
                    throw new LookupException("Child index " + index + " out of range for " + count
                            + " children of " + node);
                }
                return node.child(effective);
            }
            case CHILD_NAMED: {
                for (CatalogNode child : node.children()) {
                    if (child.matches(step.qualifier())) {
                        return child;
                    }
                }
                throw new LookupException("No child matching \"" + step.qualifier() + "\" found below " + node);
            }
            default:
                throw new IllegalStateException("Unknown step " + step);
        }
    }

    @Override
    public String toString() {
        return text;
    }
}
