package com.purchasingpower.synthflow.service.repair;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.type.ClassOrInterfaceType;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Adds imports for java.util collection types that are referenced but never imported.
 */
class MissingImportPass implements RepairPass {

    private static final Map<String, String> KNOWN_TYPES = new TreeMap<>(Map.ofEntries(
            Map.entry("List", "java.util.List"),
            Map.entry("ArrayList", "java.util.ArrayList"),
            Map.entry("LinkedList", "java.util.LinkedList"),
            Map.entry("Map", "java.util.Map"),
            Map.entry("HashMap", "java.util.HashMap"),
            Map.entry("LinkedHashMap", "java.util.LinkedHashMap"),
            Map.entry("TreeMap", "java.util.TreeMap"),
            Map.entry("Set", "java.util.Set"),
            Map.entry("HashSet", "java.util.HashSet"),
            Map.entry("TreeSet", "java.util.TreeSet"),
            Map.entry("Deque", "java.util.Deque"),
            Map.entry("ArrayDeque", "java.util.ArrayDeque"),
            Map.entry("Iterator", "java.util.Iterator"),
            Map.entry("Optional", "java.util.Optional"),
            Map.entry("Objects", "java.util.Objects"),
            Map.entry("Arrays", "java.util.Arrays"),
            Map.entry("Collections", "java.util.Collections"),
            Map.entry("Collectors", "java.util.stream.Collectors")));

    @Override
    public String name() {
        return "missing-imports";
    }

    @Override
    public boolean apply(CompilationUnit cu, RepairContext context) {
        Set<String> referenced = new TreeSet<>();
        cu.findAll(ClassOrInterfaceType.class).stream()
                .filter(t -> t.getScope().isEmpty())
                .map(ClassOrInterfaceType::getNameAsString)
                .forEach(referenced::add);
        cu.findAll(MethodCallExpr.class).stream()
                .map(MethodCallExpr::getScope)
                .flatMap(Optional::stream)
                .filter(scope -> scope.isNameExpr())
                .map(scope -> scope.asNameExpr().getNameAsString())
                .forEach(referenced::add);

        Set<String> declared = cu.findAll(TypeDeclaration.class).stream()
                .map(TypeDeclaration::getNameAsString)
                .collect(Collectors.toSet());

        boolean modified = false;
        for (String simpleName : referenced) {
            String qualified = KNOWN_TYPES.get(simpleName);
            if (qualified == null || declared.contains(simpleName) || isImported(cu, qualified)) {
                continue;
            }
            cu.addImport(qualified);
            modified = true;
        }
        return modified;
    }

    private boolean isImported(CompilationUnit cu, String qualified) {
        String packageName = qualified.substring(0, qualified.lastIndexOf('.'));
        String simpleName = qualified.substring(qualified.lastIndexOf('.') + 1);
        for (ImportDeclaration declaration : cu.getImports()) {
            String imported = declaration.getNameAsString();
            if (declaration.isAsterisk() ? imported.equals(packageName)
                    : imported.equals(qualified) || imported.endsWith("." + simpleName)) {
                return true;
            }
        }
        return false;
    }
}
