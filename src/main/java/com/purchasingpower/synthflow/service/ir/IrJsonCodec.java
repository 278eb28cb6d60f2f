package com.purchasingpower.synthflow.service.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;
import com.purchasingpower.synthflow.exception.IrFormatException;
import com.purchasingpower.synthflow.model.ir.IntermediateRepresentation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * JSON wire form of the IR, as handed in by the upstream translation stage.
 *
 * Constraints are polymorphic on their {@code type} property. Unknown properties are ignored so
 * newer producers can add fields.
 */
@Slf4j
@Component
public class IrJsonCodec {

    private final ObjectMapper mapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    public IntermediateRepresentation read(String json) {
        Preconditions.checkNotNull(json, "json must not be null");
        try {
            return mapper.readValue(json, IntermediateRepresentation.class);
        } catch (JsonProcessingException e) {
            log.error("❌ Failed to parse IR JSON: {}", e.getOriginalMessage());
            throw new IrFormatException("Malformed IR JSON: " + e.getOriginalMessage(), e);
        }
    }

    public IntermediateRepresentation read(InputStream in) {
        Preconditions.checkNotNull(in, "input stream must not be null");
        try {
            return mapper.readValue(in, IntermediateRepresentation.class);
        } catch (IOException e) {
            log.error("❌ Failed to read IR JSON: {}", e.getMessage());
            throw new IrFormatException("Malformed IR JSON: " + e.getMessage(), e);
        }
    }

    public String write(IntermediateRepresentation ir) {
        Preconditions.checkNotNull(ir, "ir must not be null");
        try {
            return mapper.writeValueAsString(ir);
        } catch (JsonProcessingException e) {
            throw new IrFormatException("Failed to serialize IR for " + ir.getSignature(), e);
        }
    }
}
