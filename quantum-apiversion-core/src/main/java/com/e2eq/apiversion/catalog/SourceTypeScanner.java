package com.e2eq.apiversion.catalog;

import com.e2eq.apiversion.exceptions.CatalogLookupException;
import com.sun.source.tree.AnnotatedTypeTree;
import com.sun.source.tree.AnnotationTree;
import com.sun.source.tree.ArrayTypeTree;
import com.sun.source.tree.AssignmentTree;
import com.sun.source.tree.ClassTree;
import com.sun.source.tree.CompilationUnitTree;
import com.sun.source.tree.ExpressionTree;
import com.sun.source.tree.IdentifierTree;
import com.sun.source.tree.MemberSelectTree;
import com.sun.source.tree.ParameterizedTypeTree;
import com.sun.source.tree.PrimitiveTypeTree;
import com.sun.source.tree.Tree;
import com.sun.source.tree.TypeParameterTree;
import com.sun.source.tree.VariableTree;
import com.sun.source.util.JavacTask;
import org.jboss.logging.Logger;

import javax.lang.model.element.Modifier;
import javax.tools.Diagnostic;
import javax.tools.DiagnosticCollector;
import javax.tools.JavaCompiler;
import javax.tools.JavaFileObject;
import javax.tools.StandardJavaFileManager;
import javax.tools.ToolProvider;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Reads class and record declarations out of {@code .java} sources without compiling them.
 * Only the syntax tree is used; nothing is attributed, so types referenced by the sources do not
 * need to be on the classpath. Files that do not parse are skipped with a warning.
 */
public final class SourceTypeScanner {

    private static final Logger LOG = Logger.getLogger(SourceTypeScanner.class);

    private static final Set<String> REQUIRED_MARKERS = Set.of("NotNull", "NotBlank", "NotEmpty");

    private final JavaCompiler compiler;

    public SourceTypeScanner() {
        this.compiler = ToolProvider.getSystemJavaCompiler();
        if (this.compiler == null) {
            throw new CatalogLookupException("source scanning needs a JDK; no system Java compiler is available");
        }
    }

    /**
     * Scans the {@code .java} files of a directory.
     *
     * @param dir       directory to scan
     * @param recursive whether sub directories are scanned too
     */
    public List<TypeInfo> scanDirectory(Path dir, boolean recursive) throws IOException {
        if (!Files.isDirectory(dir)) {
            throw new IOException("not a directory: " + dir);
        }
        List<Path> sources;
        try (Stream<Path> walk = recursive ? Files.walk(dir) : Files.list(dir)) {
            sources = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".java"))
                    .sorted()
                    .collect(Collectors.toList());
        }
        List<TypeInfo> out = new ArrayList<>();
        for (Path source : sources) {
            out.addAll(scanFile(source));
        }
        return out;
    }

    public List<TypeInfo> scanFile(Path source) throws IOException {
        DiagnosticCollector<JavaFileObject> diagnostics = new DiagnosticCollector<>();
        try (StandardJavaFileManager fileManager =
                     compiler.getStandardFileManager(diagnostics, Locale.ROOT, StandardCharsets.UTF_8)) {
            Iterable<? extends JavaFileObject> units = fileManager.getJavaFileObjects(source);
            JavacTask task = (JavacTask) compiler.getTask(null, fileManager, diagnostics,
                    List.of("-proc:none"), null, units);
            List<CompilationUnitTree> parsed = new ArrayList<>();
            task.parse().forEach(parsed::add);

            boolean broken = diagnostics.getDiagnostics().stream()
                    .anyMatch(d -> d.getKind() == Diagnostic.Kind.ERROR);
            if (broken) {
                LOG.warnf("Skipping %s: it does not parse", source);
                return List.of();
            }

            List<TypeInfo> out = new ArrayList<>();
            for (CompilationUnitTree unit : parsed) {
                String pkg = unit.getPackageName() == null ? "" : unit.getPackageName().toString();
                for (Tree decl : unit.getTypeDecls()) {
                    if (decl instanceof ClassTree) {
                        collect((ClassTree) decl, pkg, "", new HashSet<>(), out);
                    }
                }
            }
            return out;
        }
    }

    // nested types are named after their enclosing types, Device.Spec
    private void collect(ClassTree type, String pkg, String outer, Set<String> outerTypeVars, List<TypeInfo> out) {
        Tree.Kind kind = type.getKind();
        if (kind != Tree.Kind.CLASS && kind != Tree.Kind.RECORD) {
            return;
        }
        String name = outer.isEmpty() ? type.getSimpleName().toString() : outer + "." + type.getSimpleName();
        Set<String> typeVars = new HashSet<>(outerTypeVars);
        for (TypeParameterTree tp : type.getTypeParameters()) {
            typeVars.add(tp.getName().toString());
        }

        List<FieldMeta> fields = new ArrayList<>();
        for (Tree member : type.getMembers()) {
            if (member instanceof VariableTree) {
                VariableTree field = (VariableTree) member;
                Set<Modifier> flags = field.getModifiers().getFlags();
                if (flags.contains(Modifier.STATIC) || flags.contains(Modifier.TRANSIENT)) {
                    continue;
                }
                FieldMeta meta = fieldOf(field, typeVars);
                if (meta != null) {
                    fields.add(meta);
                }
            } else if (member instanceof ClassTree) {
                ClassTree nested = (ClassTree) member;
                boolean isStatic = nested.getModifiers().getFlags().contains(Modifier.STATIC)
                        || nested.getKind() == Tree.Kind.RECORD;
                collect(nested, pkg, name, isStatic ? Set.of() : typeVars, out);
            }
        }
        out.add(new TypeInfo(name, pkg, fields));
    }

    private FieldMeta fieldOf(VariableTree field, Set<String> typeVars) {
        String wireTag = "";
        boolean required = false;
        for (AnnotationTree annotation : field.getModifiers().getAnnotations()) {
            String name = TypeNames.simpleName(annotation.getAnnotationType().toString());
            if ("JsonIgnore".equals(name)) {
                return null;
            }
            if ("JsonProperty".equals(name)) {
                for (ExpressionTree arg : annotation.getArguments()) {
                    if (arg instanceof AssignmentTree) {
                        AssignmentTree assign = (AssignmentTree) arg;
                        String key = assign.getVariable().toString();
                        String value = assign.getExpression().toString();
                        if ("value".equals(key)) {
                            wireTag = WireTags.nameOf(value);
                        } else if ("required".equals(key)) {
                            required |= "true".equals(value);
                        }
                    } else {
                        wireTag = WireTags.nameOf(arg.toString());
                    }
                }
            } else if (REQUIRED_MARKERS.contains(name)) {
                required = true;
            }
        }
        return new FieldMeta(field.getName().toString(), normalize(field.getType(), typeVars), wireTag, required);
    }

    static String normalize(Tree type, Set<String> typeVars) {
        if (type == null) {
            return TypeNames.OPAQUE;
        }
        switch (type.getKind()) {
            case PRIMITIVE_TYPE:
                return ((PrimitiveTypeTree) type).getPrimitiveTypeKind().name().toLowerCase(Locale.ROOT);
            case IDENTIFIER: {
                String name = ((IdentifierTree) type).getName().toString();
                if (typeVars.contains(name)) {
                    return TypeNames.OPAQUE;
                }
                return bare(name);
            }
            case MEMBER_SELECT:
                return bare(((MemberSelectTree) type).toString());
            case ARRAY_TYPE:
                return TypeNames.sliceOf(normalize(((ArrayTypeTree) type).getType(), typeVars));
            case PARAMETERIZED_TYPE: {
                ParameterizedTypeTree generic = (ParameterizedTypeTree) type;
                String base = generic.getType().toString();
                List<? extends Tree> args = generic.getTypeArguments();
                if (TypeNames.isCollection(base)) {
                    return TypeNames.sliceOf(args.size() == 1 ? normalize(args.get(0), typeVars) : TypeNames.OPAQUE);
                }
                if (TypeNames.isMap(base)) {
                    return args.size() == 2
                            ? TypeNames.mapOf(normalize(args.get(0), typeVars), normalize(args.get(1), typeVars))
                            : TypeNames.mapOf(TypeNames.OPAQUE, TypeNames.OPAQUE);
                }
                if (TypeNames.isOptional(base)) {
                    return TypeNames.pointerOf(args.size() == 1 ? normalize(args.get(0), typeVars) : TypeNames.OPAQUE);
                }
                return TypeNames.named(base);
            }
            case ANNOTATED_TYPE:
                return normalize(((AnnotatedTypeTree) type).getUnderlyingType(), typeVars);
            default:
                // wildcards, unions, intersections and var
                return TypeNames.OPAQUE;
        }
    }

    // raw collection and map types without arguments
    private static String bare(String name) {
        if (TypeNames.isCollection(name)) {
            return TypeNames.sliceOf(TypeNames.OPAQUE);
        }
        if (TypeNames.isMap(name)) {
            return TypeNames.mapOf(TypeNames.OPAQUE, TypeNames.OPAQUE);
        }
        if (TypeNames.isOptional(name)) {
            return TypeNames.pointerOf(TypeNames.OPAQUE);
        }
        if ("var".equals(name)) {
            return TypeNames.OPAQUE;
        }
        return TypeNames.named(name);
    }
}
