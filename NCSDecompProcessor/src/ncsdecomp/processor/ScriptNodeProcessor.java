package ncsdecomp.processor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import javax.annotation.processing.AbstractProcessor;
import javax.annotation.processing.Processor;
import javax.annotation.processing.RoundEnvironment;
import javax.lang.model.SourceVersion;
import javax.lang.model.element.Element;
import javax.lang.model.element.ElementKind;
import javax.lang.model.element.ExecutableElement;
import javax.lang.model.element.Modifier;
import javax.lang.model.element.TypeElement;
import javax.lang.model.type.TypeKind;
import javax.lang.model.type.TypeMirror;
import javax.tools.Diagnostic.Kind;
import javax.tools.FileObject;
import javax.tools.JavaFileObject;
import javax.tools.StandardLocation;

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing for the reconstructed script tree.
 *
 * <p>For every {@link ScriptNode} class {@code Outer.Inner} a {@code Outer_Inner_ScriptNode}
 * interface is written with {@code accept} and {@code visitChildren} default methods; the latter
 * visits each {@link ScriptChild} accessor in declaration order, looping over lists and
 * unwrapping optionals in place. Once all rounds are done, {@code ScriptVisitor}, {@code
 * DefaultScriptVisitor} and {@code VoidDefaultScriptVisitor} are written with one method per node
 * class.
 */
@AutoService(Processor.class)
public class ScriptNodeProcessor extends AbstractProcessor {

  private static final String PACKAGE = "ncsdecomp";
  private static final String NODE_LIST = "META-INF/scriptNodes/list.txt";

  private static final ClassName NODE_INTERFACE_NAME =
      ClassName.get(PACKAGE, "ScriptNodeInterface");
  private static final ClassName VISITOR_NAME = ClassName.get(PACKAGE, "ScriptVisitor");
  private static final TypeVariableName V = TypeVariableName.get("V");

  private static final String ITERABLE = "java.lang.Iterable";
  private static final String OPTIONAL = "java.util.Optional";

  private final Set<String> allScriptNodes = new TreeSet<>();

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ScriptNode.class.getName(), ScriptChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        generateVisitorFiles();
      } else if (!annotations.isEmpty()) {
        processImpl(roundEnv);
      }
    } catch (IOException ex) {
      processingEnv.getMessager().printMessage(Kind.ERROR, "I/O failure: " + ex);
    }

    return true;
  }

  // Incremental builds only recompile some nodes, so the list from the last build is merged in.
  private void mergeNodeList() throws IOException {
    FileObject file;
    boolean exists;
    try {
      file = processingEnv.getFiler().getResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST);
      try (BufferedReader br =
          new BufferedReader(
              new InputStreamReader(file.openInputStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = br.readLine()) != null) {
          line = line.trim();
          if (!line.isEmpty()) {
            allScriptNodes.add(line);
          }
        }
      }
      exists = true;
    } catch (IOException missing) {
      exists = false;
    }

    if (!exists) {
      file = processingEnv.getFiler().createResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST);
    } else {
      file = processingEnv.getFiler().getResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST);
    }
    try (Writer wr = file.openWriter()) {
      wr.append(allScriptNodes.stream().collect(Collectors.joining("\n", "", "\n")));
    }
  }

  @FunctionalInterface
  private static interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeFile(String name, String format, TypeRenderer typeRenderer) throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              allScriptNodes
                  .stream()
                  .map(typeRenderer::renderType)
                  .collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateVisitorFiles() throws IOException {
    mergeNodeList();

    writeFile(
        "ScriptVisitor",
        "package " + PACKAGE + ";\n\ninterface ScriptVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeFile(
        "DefaultScriptVisitor",
        "package "
            + PACKAGE
            + ";\n\n"
            + "public abstract class DefaultScriptVisitor<V> implements ScriptVisitor<V> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return node.visitChildren(this, value);\n"
                    + "  }",
                typeName));
    writeFile(
        "VoidDefaultScriptVisitor",
        "package "
            + PACKAGE
            + ";\n\n"
            + "public abstract class VoidDefaultScriptVisitor"
            + " extends DefaultScriptVisitor<Void> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%s node) {\n"
                    + "    node.visitChildren(this, null);\n"
                    + "  }",
                typeName, typeName));
  }

  private static String interfaceName(Element element) {
    Deque<String> elems = new ArrayDeque<>();
    elems.push("ScriptNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        elems.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return String.join("_", elems);
  }

  /** How a {@link ScriptChild} accessor hands out its nodes. */
  private enum ChildShape {
    NODE,
    ITERABLE,
    OPTIONAL
  }

  private Optional<ChildShape> childShape(TypeMirror type) {
    if (type.getKind() != TypeKind.DECLARED) return Optional.empty();
    if (isAssignableToErasure(type, ITERABLE)) return Optional.of(ChildShape.ITERABLE);
    if (isAssignableToErasure(type, OPTIONAL)) return Optional.of(ChildShape.OPTIONAL);
    TypeElement nodeInterface =
        processingEnv.getElementUtils().getTypeElement(NODE_INTERFACE_NAME.canonicalName());
    // The interface is missing only while the round that declares it is still running.
    if (nodeInterface == null
        || processingEnv.getTypeUtils().isAssignable(type, nodeInterface.asType())) {
      return Optional.of(ChildShape.NODE);
    }
    return Optional.empty();
  }

  private boolean isAssignableToErasure(TypeMirror type, String container) {
    TypeElement containerElement = processingEnv.getElementUtils().getTypeElement(container);
    return processingEnv
        .getTypeUtils()
        .isAssignable(
            processingEnv.getTypeUtils().erasure(type),
            processingEnv.getTypeUtils().erasure(containerElement.asType()));
  }

  private void writeNodeInterface(TypeElement element) throws IOException {
    String interfaceName = interfaceName(element);
    if (element
        .getInterfaces()
        .stream()
        .noneMatch(i -> TypeName.get(i).toString().endsWith(interfaceName))) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(NODE_INTERFACE_NAME);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(VISITOR_NAME, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build())
            .addStatement(
                "return visitor.visit(($L) this, value)", element.getQualifiedName().toString())
            .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(
                ParameterSpec.builder(ParameterizedTypeName.get(VISITOR_NAME, V), "visitor")
                    .build())
            .addParameter(ParameterSpec.builder(V, "value").build());
    for (Element maybeMethod : element.getEnclosedElements()) {
      if (maybeMethod.getKind() != ElementKind.METHOD) continue;
      if (maybeMethod.getAnnotation(ScriptChild.class) == null) continue;
      if (maybeMethod.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", maybeMethod);
      }

      ExecutableElement method = (ExecutableElement) maybeMethod;
      Optional<ChildShape> shape = childShape(method.getReturnType());
      if (!method.getParameters().isEmpty() || !shape.isPresent()) {
        processingEnv
            .getMessager()
            .printMessage(
                Kind.ERROR,
                "@ScriptChild must be a no-arg accessor of a node, an Iterable or an Optional",
                method);
        continue;
      }

      String accessor = method.getSimpleName().toString();
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(accessor)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());

      switch (shape.get()) {
        case NODE:
          visitChildren.addStatement("value = $L().accept(visitor, value)", accessor);
          break;
        case ITERABLE:
          visitChildren
              .beginControlFlow("for ($T child : $L())", NODE_INTERFACE_NAME, accessor)
              .addStatement("value = child.accept(visitor, value)")
              .endControlFlow();
          break;
        case OPTIONAL:
          visitChildren
              .beginControlFlow("if ($L().isPresent())", accessor)
              .addStatement("value = $L().get().accept(visitor, value)", accessor)
              .endControlFlow();
          break;
      }
    }
    typeSpecBuilder.addMethod(visitChildren.addStatement("return value").build());

    JavaFile javaFile = JavaFile.builder(PACKAGE, typeSpecBuilder.build()).build();
    JavaFileObject file = processingEnv.getFiler().createSourceFile(PACKAGE + "." + interfaceName);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }

  private void processImpl(RoundEnvironment roundEnv) {
    for (Element element : roundEnv.getElementsAnnotatedWith(ScriptNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      try {
        writeNodeInterface(typeElement);
      } catch (IOException | RuntimeException ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }

      String wildcards = "";
      if (!typeElement.getTypeParameters().isEmpty()) {
        wildcards =
            typeElement
                .getTypeParameters()
                .stream()
                .map(p -> "?")
                .collect(Collectors.joining(", ", "<", ">"));
      }
      allScriptNodes.add(typeElement.getQualifiedName().toString() + wildcards);
    }
  }
}
