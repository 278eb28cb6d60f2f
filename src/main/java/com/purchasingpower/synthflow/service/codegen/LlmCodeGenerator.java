package com.purchasingpower.synthflow.service.codegen;

import com.purchasingpower.synthflow.client.LLMProvider;
import com.purchasingpower.synthflow.exception.CodeGenerationException;
import com.purchasingpower.synthflow.model.ir.AssertClause;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import com.purchasingpower.synthflow.model.ir.Parameter;
import com.purchasingpower.synthflow.model.ir.SignatureClause;
import com.purchasingpower.synthflow.service.constraint.ViolationFeedbackFormatter;
import com.purchasingpower.synthflow.service.prompt.PromptLibraryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Renders the generation prompt from the IR and its constraint hints, then asks the LLM.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LlmCodeGenerator implements CodeGenerator {

    static final String GENERATION_TEMPLATE = "constraint-code-generation";
    static final String FEEDBACK_TEMPLATE = "constraint-feedback";

    private static final Pattern CODE_FENCE = Pattern.compile("```(?:java)?\\s*\\n(.*?)```", Pattern.DOTALL);

    private final LLMProvider llmProvider;
    private final PromptLibraryService promptLibrary;
    private final ViolationFeedbackFormatter feedbackFormatter;

    @Override
    public String generate(GenerationContext context) {
        String functionName = context.functionName();
        String prompt = buildPrompt(context);

        String response;
        try {
            response = llmProvider.chat(prompt, context.getTemperature(), "code-generator");
        } catch (RuntimeException e) {
            throw new CodeGenerationException("LLM call failed: " + e.getMessage(), functionName, e);
        }

        String code = extractCode(response);
        if (code.isBlank()) {
            throw new CodeGenerationException("LLM returned no code", functionName);
        }
        log.debug("Generated {} chars for {} (attempt {}, temperature {})",
                code.length(), functionName, context.getAttempt(), context.getTemperature());
        return code;
    }

    String buildPrompt(GenerationContext context) {
        IntermediateRepresentation ir = context.getIr();
        Map<String, Object> variables = new HashMap<>();
        variables.put("functionName", context.functionName());
        variables.put("signature", renderSignature(ir.getSignature()));
        variables.put("intent", ir.getIntent() == null ? "" : ir.getIntent().getSummary());
        variables.put("effects", ir.effectDescriptions());
        variables.put("assertions", ir.getAssertions().stream()
                .map(AssertClause::getPredicate)
                .collect(Collectors.toList()));
        variables.put("constraints", ir.getConstraints().stream()
                .map(feedbackFormatter::hint)
                .collect(Collectors.toList()));
        variables.put("hasConstraints", !ir.getConstraints().isEmpty());

        String prompt = promptLibrary.render(GENERATION_TEMPLATE, variables);
        if (!context.isRetry()) {
            return prompt;
        }

        Map<String, Object> retryVariables = new HashMap<>();
        retryVariables.put("attempt", context.getAttempt());
        retryVariables.put("previousCode", context.getPreviousCode() == null ? "" : context.getPreviousCode());
        retryVariables.put("feedback", context.getFeedback());
        return prompt + "\n\n" + promptLibrary.render(FEEDBACK_TEMPLATE, retryVariables);
    }

    static String renderSignature(SignatureClause signature) {
        if (signature == null) {
            return "";
        }
        String returns = signature.declaresReturnValue() ? signature.getReturns() : "void";
        String parameters = signature.getParameters().stream()
                .map(LlmCodeGenerator::renderParameter)
                .collect(Collectors.joining(", "));
        return "public static " + returns + " " + signature.getName() + "(" + parameters + ")";
    }

    private static String renderParameter(Parameter parameter) {
        String type = parameter.getTypeHint() == null ? "Object" : parameter.getTypeHint();
        return type + " " + parameter.getName();
    }

    /**
     * Contents of the first fenced block, or the whole response when it has none.
     */
    static String extractCode(String response) {
        if (response == null) {
            return "";
        }
        Matcher matcher = CODE_FENCE.matcher(response);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return response.trim();
    }
}
