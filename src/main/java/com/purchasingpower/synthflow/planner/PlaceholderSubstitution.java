package com.purchasingpower.synthflow.planner;

import com.purchasingpower.synthflow.model.ir.IntentClause;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.Parameter;
import com.purchasingpower.synthflow.model.ir.SignatureClause;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Replaces {@code <?id?>} and {@code <?id: type?>} placeholders in clause text.
 */
public final class PlaceholderSubstitution {

    static final Pattern PLACEHOLDER = Pattern.compile("<\\?\\s*([A-Za-z_][\\w.\\-]*)\\s*(?::[^?]*)?\\?>");

    private PlaceholderSubstitution() {
    }

    public static IntermediateRepresentation apply(IntermediateRepresentation ir, Map<String, String> values) {
        if (values.isEmpty()) {
            return ir;
        }
        IntermediateRepresentation.IntermediateRepresentationBuilder builder = ir.toBuilder();
        if (ir.getIntent() != null) {
            IntentClause intent = ir.getIntent();
            builder.intent(intent.toBuilder()
                    .summary(substitute(intent.getSummary(), values))
                    .rationale(substitute(intent.getRationale(), values))
                    .build());
        }
        if (ir.getSignature() != null) {
            builder.signature(substitute(ir.getSignature(), values));
        }
        builder.effects(ir.getEffects().stream()
                .map(e -> e.toBuilder().description(substitute(e.getDescription(), values)).build())
                .collect(Collectors.toList()));
        builder.assertions(ir.getAssertions().stream()
                .map(a -> a.toBuilder()
                        .predicate(substitute(a.getPredicate(), values))
                        .rationale(substitute(a.getRationale(), values))
                        .build())
                .collect(Collectors.toList()));
        return builder.build();
    }

    private static SignatureClause substitute(SignatureClause signature, Map<String, String> values) {
        return signature.toBuilder()
                .name(substitute(signature.getName(), values))
                .returns(substitute(signature.getReturns(), values))
                .parameters(signature.getParameters().stream()
                        .map(p -> substitute(p, values))
                        .collect(Collectors.toList()))
                .build();
    }

    private static Parameter substitute(Parameter parameter, Map<String, String> values) {
        return parameter.toBuilder()
                .name(substitute(parameter.getName(), values))
                .typeHint(substitute(parameter.getTypeHint(), values))
                .description(substitute(parameter.getDescription(), values))
                .build();
    }

    static String substitute(String text, Map<String, String> values) {
        if (text == null || text.indexOf("<?") < 0) {
            return text;
        }
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(out, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(out);
        return out.toString();
    }
}
