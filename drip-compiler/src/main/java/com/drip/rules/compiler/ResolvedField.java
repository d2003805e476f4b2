package com.drip.rules.compiler;

import com.drip.rules.api.query.Annotation;

import java.util.Objects;
import java.util.Optional;

/**
 * The field a predicate should address, plus the annotation that must exist first.
 *
 * @param effectiveField the field name or annotation alias used in the predicate
 * @param annotation     the annotation to add, if the rule addresses a count
 */
public record ResolvedField(String effectiveField, Optional<Annotation> annotation) {

    public ResolvedField {
        Objects.requireNonNull(effectiveField, "effectiveField");
        Objects.requireNonNull(annotation, "annotation");
    }

    public static ResolvedField direct(String field) {
        return new ResolvedField(field, Optional.empty());
    }

    public static ResolvedField annotated(Annotation annotation) {
        return new ResolvedField(annotation.alias(), Optional.of(annotation));
    }

    public boolean isAnnotated() {
        return annotation.isPresent();
    }
}
