package cws.processor;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Deque;
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
 * Generates, for every {@link ASTNode} class, an {@code _ASTNode} interface with {@code accept} and
 * {@code visitChildren}, and once all rounds are done, the {@code ASTVisitor},
 * {@code DefaultASTVisitor} and {@code VoidDefaultASTVisitor} types covering every node class.
 *
 * <p>All node classes must live in a single package; the visitor types are generated there.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String NODE_LIST_RESOURCE = "META-INF/cws/astNodes.txt";
  private static final String PACKAGE_PREFIX = "#package ";

  private static final TypeVariableName V = TypeVariableName.get("V");

  // Sorted so the generated visitor is stable across builds.
  private final Set<String> allAstNodes = new TreeSet<>();
  private String nodePackage = null;

  @Override
  public SourceVersion getSupportedSourceVersion() {
    return SourceVersion.latestSupported();
  }

  @Override
  public ImmutableSet<String> getSupportedAnnotationTypes() {
    return ImmutableSet.of(ASTNode.class.getName(), ASTChild.class.getName());
  }

  @Override
  public boolean process(Set<? extends TypeElement> annotations, RoundEnvironment roundEnv) {
    try {
      if (roundEnv.processingOver()) {
        generateVisitorFiles();
      } else if (!annotations.isEmpty()) {
        processRound(roundEnv);
      }
    } catch (IOException ex) {
      throw new RuntimeException(ex);
    }

    return true;
  }

  private void processRound(RoundEnvironment roundEnv) throws IOException {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      String elementPackage =
          processingEnv.getElementUtils().getPackageOf(typeElement).getQualifiedName().toString();
      if (nodePackage == null) {
        nodePackage = elementPackage;
      } else if (!nodePackage.equals(elementPackage)) {
        processingEnv
            .getMessager()
            .printMessage(
                Kind.ERROR, "@ASTNode classes must all be in package " + nodePackage, typeElement);
        continue;
      }

      try {
        writeNodeInterface(typeElement);
      } catch (Exception ex) {
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
      allAstNodes.add(typeElement.getQualifiedName().toString() + wildcards);
    }
  }

  // Merges with the list left by an earlier (incremental) compilation, then rewrites it.
  private void mergeNodeList() throws IOException {
    boolean needsCreate;
    FileObject file = null;
    try {
      file = processingEnv.getFiler().getResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST_RESOURCE);
      try (BufferedReader br =
          new BufferedReader(new InputStreamReader(file.openInputStream(), StandardCharsets.UTF_8))) {
        String line;
        while ((line = br.readLine()) != null) {
          line = line.trim();
          if (line.startsWith(PACKAGE_PREFIX)) {
            if (nodePackage == null) nodePackage = line.substring(PACKAGE_PREFIX.length());
          } else if (!line.isEmpty()) {
            allAstNodes.add(line);
          }
        }
      }
      needsCreate = false;
    } catch (IOException | IllegalArgumentException ex) {
      // Clean build: nothing was recorded before.
      needsCreate = true;
    }

    if (needsCreate) {
      file =
          processingEnv.getFiler().createResource(StandardLocation.CLASS_OUTPUT, "", NODE_LIST_RESOURCE);
    }
    try (Writer wr = file.openWriter()) {
      wr.append(PACKAGE_PREFIX).append(nodePackage).append('\n');
      wr.append(allAstNodes.stream().collect(Collectors.joining("\n", "", "\n")));
    }
  }

  @FunctionalInterface
  private interface TypeRenderer {
    String renderType(String typeName);
  }

  private void writeVisitorFile(String name, String format, TypeRenderer typeRenderer)
      throws IOException {
    JavaFileObject file = processingEnv.getFiler().createSourceFile(nodePackage + "." + name);
    try (Writer wr = file.openWriter()) {
      wr.append(
          String.format(
              format,
              nodePackage,
              allAstNodes.stream().map(typeRenderer::renderType).collect(Collectors.joining("\n\n"))));
    }
  }

  private void generateVisitorFiles() throws IOException {
    if (nodePackage == null) return;
    mergeNodeList();

    writeVisitorFile(
        "ASTVisitor",
        "package %s;\n\ninterface ASTVisitor<V> {\n\n%s\n\n}\n",
        typeName -> String.format("  V visit(%s node, V value);", typeName));
    writeVisitorFile(
        "DefaultASTVisitor",
        "package %s;\n\n"
            + "public abstract class DefaultASTVisitor<V> implements ASTVisitor<V> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public V visit(%s node, V value) {\n"
                    + "    return node.visitChildren(this, value);\n"
                    + "  }",
                typeName));
    writeVisitorFile(
        "VoidDefaultASTVisitor",
        "package %s;\n\n"
            + "public abstract class VoidDefaultASTVisitor extends DefaultASTVisitor<Void> {\n\n"
            + "%s\n\n}\n",
        typeName ->
            String.format(
                "  @Override\n"
                    + "  public final Void visit(%1$s node, Void value) {\n"
                    + "    visitImpl(node);\n"
                    + "    return null;\n"
                    + "  }\n\n"
                    + "  public void visitImpl(%1$s node) {\n"
                    + "    node.visitChildren(this, null);\n"
                    + "  }",
                typeName));
  }

  // Node.Scalar -> Node_Scalar_ASTNode
  private static String interfaceName(Element element) {
    Deque<String> names = new ArrayDeque<>();
    names.push("ASTNode");
    do {
      if (element.getKind() == ElementKind.CLASS) {
        names.addFirst(element.getSimpleName().toString());
      }
      element = element.getEnclosingElement();
    } while (element.getKind() != ElementKind.PACKAGE);
    return String.join("_", names);
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

    ClassName nodeInterface = ClassName.get(nodePackage, "ASTNodeInterface");
    ClassName visitor = ClassName.get(nodePackage, "ASTVisitor");
    ClassName nodeUtils = ClassName.get(nodePackage, "ASTNodeUtils");
    ParameterSpec visitorParam =
        ParameterSpec.builder(ParameterizedTypeName.get(visitor, V), "visitor").build();
    ParameterSpec valueParam = ParameterSpec.builder(V, "value").build();

    TypeSpec.Builder typeSpecBuilder =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(nodeInterface);

    typeSpecBuilder.addMethod(
        MethodSpec.methodBuilder("accept")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorParam)
            .addParameter(valueParam)
            .addStatement(
                "return visitor.visit(($L) this, value)", element.getQualifiedName().toString())
            .build());

    MethodSpec.Builder visitChildren =
        MethodSpec.methodBuilder("visitChildren")
            .addAnnotation(Override.class)
            .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
            .addTypeVariable(V)
            .returns(V)
            .addParameter(visitorParam)
            .addParameter(valueParam);
    for (Element member : element.getEnclosedElements()) {
      if (member.getKind() != ElementKind.METHOD) continue;
      if (member.getAnnotation(ASTChild.class) == null) continue;
      if (member.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", member);
      }

      ExecutableElement method = (ExecutableElement) member;
      typeSpecBuilder.addMethod(
          MethodSpec.methodBuilder(method.getSimpleName().toString())
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());

      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", nodeUtils, method.getSimpleName().toString());
    }
    typeSpecBuilder.addMethod(visitChildren.addStatement("return value").build());

    JavaFile javaFile = JavaFile.builder(nodePackage, typeSpecBuilder.build()).build();
    JavaFileObject file = processingEnv.getFiler().createSourceFile(nodePackage + "." + interfaceName);
    try (Writer wr = file.openWriter()) {
      wr.append(javaFile.toString());
    }
  }
}
