package org.neuralchilli.pipeflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.pipeflow.domain.Param;
import org.neuralchilli.pipeflow.domain.ParamValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces {@code $(...)} references in strings, string lists and parameter values.
 * References the context cannot answer are left in place.
 */
@ApplicationScoped
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private static final Pattern REFERENCE = Pattern.compile("\\$\\(([^()\\s]+)\\)");
    private static final Pattern RESULT_REFERENCE = Pattern.compile("^tasks\\.([^.]+)\\.results\\.([^.]+)$");
    private static final String ARRAY_SUFFIX = "[*]";

    /**
     * Substitute every string-valued reference found in {@code template}.
     */
    public String evaluate(String template, ExpressionContext context) {
        if (template == null || !isExpression(template)) {
            return template;
        }

        Matcher matcher = REFERENCE.matcher(template);
        StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            ParamValue value = context.lookup(matcher.group(1));
            String replacement = value != null && !value.isArray() ? value.stringVal() : matcher.group();
            matcher.appendReplacement(result, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Substitute each element; an element that is exactly an array reference
     * ({@code $(params.x[*])} or {@code $(params.x)}) expands in place.
     */
    public List<String> evaluate(List<String> templates, ExpressionContext context) {
        List<String> result = new ArrayList<>(templates.size());
        for (String template : templates) {
            ParamValue array = wholeArrayReference(template, context);
            if (array != null) {
                result.addAll(array.arrayVal());
            } else {
                result.add(evaluate(template, context));
            }
        }
        return result;
    }

    /**
     * Substitute a value. A string that is exactly one array reference becomes that array.
     */
    public ParamValue evaluate(ParamValue value, ExpressionContext context) {
        if (value.isArray()) {
            return ParamValue.ofArray(evaluate(value.arrayVal(), context));
        }
        ParamValue array = wholeArrayReference(value.stringVal(), context);
        if (array != null) {
            return array;
        }
        return ParamValue.ofString(evaluate(value.stringVal(), context));
    }

    public List<Param> evaluateParams(List<Param> params, ExpressionContext context) {
        return params.stream()
                .map(p -> new Param(p.name(), evaluate(p.value(), context)))
                .toList();
    }

    public boolean isExpression(String value) {
        return value != null && value.contains("$(");
    }

    /**
     * Every reference in {@code template}, in order of appearance, without duplicates.
     */
    public Set<String> references(String template) {
        Set<String> references = new LinkedHashSet<>();
        if (template == null) {
            return references;
        }
        Matcher matcher = REFERENCE.matcher(template);
        while (matcher.find()) {
            references.add(matcher.group(1));
        }
        return references;
    }

    /**
     * Every {@code tasks.<task>.results.<name>} reference in {@code template}.
     */
    public Set<ResultReference> resultReferences(String template) {
        Set<ResultReference> result = new LinkedHashSet<>();
        for (String reference : references(template)) {
            Matcher matcher = RESULT_REFERENCE.matcher(reference);
            if (matcher.matches()) {
                result.add(ResultReference.of(matcher.group(1), matcher.group(2)));
            }
        }
        return result;
    }

    public Set<ResultReference> resultReferences(ParamValue value) {
        if (!value.isArray()) {
            return resultReferences(value.stringVal());
        }
        Set<ResultReference> result = new LinkedHashSet<>();
        value.arrayVal().forEach(element -> result.addAll(resultReferences(element)));
        return result;
    }

    public Set<ResultReference> resultReferences(List<Param> params) {
        Set<ResultReference> result = new LinkedHashSet<>();
        params.forEach(p -> result.addAll(resultReferences(p.value())));
        return result;
    }

    private ParamValue wholeArrayReference(String template, ExpressionContext context) {
        if (template == null) {
            return null;
        }
        Matcher matcher = REFERENCE.matcher(template);
        if (!matcher.matches()) {
            return null;
        }
        String reference = matcher.group(1);
        if (reference.endsWith(ARRAY_SUFFIX)) {
            reference = reference.substring(0, reference.length() - ARRAY_SUFFIX.length());
        }
        ParamValue value = context.lookup(reference);
        if (value != null && value.isArray()) {
            log.trace("Expanding array reference {} to {} elements", reference, value.arrayVal().size());
            return value;
        }
        return null;
    }
}
