package org.srcgen;

import org.srcgen.ast.Module;
import org.srcgen.objc.ObjectiveCEmitter;
import org.srcgen.printer.EmitterConfiguration;
import org.srcgen.printer.PythonSourceEmitter;
import org.srcgen.printer.SourceEmitter;

import java.util.Objects;

/**
 * Entry point for turning a parsed {@link Module} into source text.
 * <pre>{@code
 * GenerationResult result = SourceGen.toSource(module, SourceGen.Backend.OBJECTIVE_C);
 * result.getSource();
 * result.getDiagnostics();
 * }</pre>
 * Every call runs on a fresh emitter, so calls are independent of each other.
 */
public final class SourceGen {

    public enum Backend {
        /** Prints the tree back in its own syntax. */
        MIRROR {
            @Override
            public SourceEmitter newEmitter(EmitterConfiguration configuration) {
                return new PythonSourceEmitter(configuration);
            }
        },
        /** Translates the tree into Objective-C. */
        OBJECTIVE_C {
            @Override
            public SourceEmitter newEmitter(EmitterConfiguration configuration) {
                return new ObjectiveCEmitter(configuration);
            }
        };

        public abstract SourceEmitter newEmitter(EmitterConfiguration configuration);
    }

    private SourceGen() {
    }

    public static GenerationResult toSource(Module module) {
        return toSource(module, Backend.MIRROR);
    }

    public static GenerationResult toSource(Module module, Backend backend) {
        return toSource(module, backend, EmitterConfiguration.defaults());
    }

    /**
     * @throws SourceGenerationException if the tree contains a node or operator the backend cannot render
     */
    public static GenerationResult toSource(Module module, Backend backend, EmitterConfiguration configuration) {
        Objects.requireNonNull(module, "module");
        Objects.requireNonNull(backend, "backend");
        Objects.requireNonNull(configuration, "configuration");
        return backend.newEmitter(configuration).generate(module);
    }
}
