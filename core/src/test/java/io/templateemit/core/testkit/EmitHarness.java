package io.templateemit.core.testkit;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.templateemit.core.engine.EmitterContext;
import io.templateemit.core.engine.ExpressionEmitter;
import java.io.IOException;
import java.io.StringWriter;

/** Runs an emission against an in-memory Jackson generator and returns the written JSON. */
public final class EmitHarness {

    public static final ObjectMapper JSON = new ObjectMapper();

    private static final JsonFactory FACTORY = new JsonFactory();

    private EmitHarness() {}

    @FunctionalInterface
    public interface Emission {
        void run(ExpressionEmitter emitter) throws IOException;
    }

    /** Emits a single value. */
    public static String emitValueText(EmitterContext context, Emission emission) throws IOException {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = FACTORY.createGenerator(out)) {
            emission.run(new ExpressionEmitter(generator, context));
        }
        return out.toString();
    }

    public static JsonNode emitValue(EmitterContext context, Emission emission) throws IOException {
        return JSON.readTree(emitValueText(context, emission));
    }

    /** Emits properties inside an enclosing object. */
    public static String emitObjectText(EmitterContext context, Emission emission) throws IOException {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = FACTORY.createGenerator(out)) {
            ExpressionEmitter emitter = new ExpressionEmitter(generator, context);
            generator.writeStartObject();
            emission.run(emitter);
            generator.writeEndObject();
        }
        return out.toString();
    }

    public static JsonNode emitObject(EmitterContext context, Emission emission) throws IOException {
        return JSON.readTree(emitObjectText(context, emission));
    }
}
