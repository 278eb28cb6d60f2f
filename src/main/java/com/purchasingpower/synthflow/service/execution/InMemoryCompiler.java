package com.purchasingpower.synthflow.service.execution;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.FileObject;
import javax.tools.ForwardingJavaFileManager;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileManager;
import javax.tools.JavaFileObject;
import javax.tools.SimpleJavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * In-memory Java compilation using the Java Compiler API.
 *
 * <p>Neither sources nor class files touch the disk. Each call gets its own output file
 * manager, so concurrent compilations do not share state.
 */
@Slf4j
@Component
public class InMemoryCompiler {

    private final JavaCompiler compiler;

    public InMemoryCompiler() {
        this.compiler = ToolProvider.getSystemJavaCompiler();
        if (compiler == null) {
            throw new IllegalStateException("No Java compiler available. Are you running on a JDK (not JRE)?");
        }
    }

    public CompilationResult compile(String sourceCode, String className) {
        Preconditions.checkNotNull(sourceCode, "Source code cannot be null");
        Preconditions.checkArgument(className != null && !className.isEmpty(), "Class name cannot be empty");

        long startTime = System.currentTimeMillis();
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();

        try (StandardJavaFileManager standard = compiler.getStandardFileManager(diagnostics, Locale.ENGLISH, null);
             ClassCollectingFileManager fileManager = new ClassCollectingFileManager(standard)) {

            JavaCompiler.CompilationTask task = compiler.getTask(
                    null,
                    fileManager,
                    diagnostics,
                    List.of("-proc:none", "-nowarn"),
                    null,
                    List.of(new InMemoryJavaFile(className, sourceCode)));

            boolean success = task.call();
            long timeMs = System.currentTimeMillis() - startTime;

            if (success) {
                log.debug("✅ Compiled {} in {}ms", className, timeMs);
                return CompilationResult.success(fileManager.classes(), timeMs);
            }
            List<CompilationError> errors = diagnostics.getDiagnostics().stream()
                    .filter(d -> d.getKind() == Diagnostic.Kind.ERROR)
                    .map(InMemoryCompiler::toCompilationError)
                    .collect(Collectors.toList());
            log.debug("❌ Compilation of {} failed with {} errors in {}ms", className, errors.size(), timeMs);
            return CompilationResult.failure(errors, timeMs);

        } catch (IOException | RuntimeException e) {
            long timeMs = System.currentTimeMillis() - startTime;
            log.error("Compilation of {} threw exception", className, e);
            CompilationError error = CompilationError.builder()
                    .message("Compilation threw exception: " + e.getMessage())
                    .kind("EXCEPTION")
                    .build();
            return CompilationResult.failure(List.of(error), timeMs);
        }
    }

    private static CompilationError toCompilationError(Diagnostic<? extends JavaFileObject> diagnostic) {
        return CompilationError.builder()
                .line((int) diagnostic.getLineNumber())
                .column((int) diagnostic.getColumnNumber())
                .message(diagnostic.getMessage(Locale.ENGLISH))
                .kind(diagnostic.getKind().name())
                .build();
    }

    private static class InMemoryJavaFile extends SimpleJavaFileObject {
        private final String code;

        InMemoryJavaFile(String className, String code) {
            super(URI.create("string:///" + className.replace('.', '/') + Kind.SOURCE.extension), Kind.SOURCE);
            this.code = code;
        }

        @Override
        public CharSequence getCharContent(boolean ignoreEncodingErrors) {
            return code;
        }
    }

    private static class ClassOutput extends SimpleJavaFileObject {
        private final ByteArrayOutputStream bytes = new ByteArrayOutputStream();

        ClassOutput(String className) {
            super(URI.create("bytes:///" + className.replace('.', '/') + Kind.CLASS.extension), Kind.CLASS);
        }

        @Override
        public OutputStream openOutputStream() {
            return bytes;
        }
    }

    private static class ClassCollectingFileManager extends ForwardingJavaFileManager<JavaFileManager> {
        private final Map<String, ClassOutput> outputs = new HashMap<>();

        ClassCollectingFileManager(JavaFileManager delegate) {
            super(delegate);
        }

        @Override
        public JavaFileObject getJavaFileForOutput(Location location, String className,
                                                   JavaFileObject.Kind kind, FileObject sibling) {
            ClassOutput output = new ClassOutput(className);
            outputs.put(className, output);
            return output;
        }

        Map<String, byte[]> classes() {
            Map<String, byte[]> classes = new HashMap<>();
            outputs.forEach((name, output) -> classes.put(name, output.bytes.toByteArray()));
            return classes;
        }
    }
}
