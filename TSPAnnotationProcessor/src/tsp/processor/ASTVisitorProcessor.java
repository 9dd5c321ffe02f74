package tsp.processor;

import java.io.IOException;
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

import com.google.auto.service.AutoService;
import com.google.common.collect.ImmutableSet;
import com.squareup.javapoet.ClassName;
import com.squareup.javapoet.JavaFile;
import com.squareup.javapoet.MethodSpec;
import com.squareup.javapoet.ParameterizedTypeName;
import com.squareup.javapoet.TypeName;
import com.squareup.javapoet.TypeSpec;
import com.squareup.javapoet.TypeVariableName;

/**
 * Generates the visitor plumbing for command-tree nodes.
 *
 * <p>Each {@link ASTNode} type gets an {@code Outer_Inner_ASTNode} interface with default {@code
 * accept} and {@code visitChildren} methods, the latter visiting every {@link ASTChild} accessor
 * in declaration order. In the same round, {@code ASTVisitor}, {@code DefaultASTVisitor} and {@code
 * VoidDefaultASTVisitor} are written with one {@code visit} method per node type, so that the
 * generated sources are compiled along with the nodes that implement them.
 */
@AutoService(Processor.class)
public class ASTVisitorProcessor extends AbstractProcessor {

  private static final String PACKAGE = "tsp";

  private static final ClassName TREE_NODE_NAME = ClassName.get(PACKAGE, "TreeNode");
  private static final ClassName AST_VISITOR_NAME = ClassName.get(PACKAGE, "ASTVisitor");
  private static final ClassName DEFAULT_AST_VISITOR_NAME =
      ClassName.get(PACKAGE, "DefaultASTVisitor");
  private static final ClassName TREE_NODES_NAME = ClassName.get(PACKAGE, "TreeNodes");
  private static final TypeVariableName V = TypeVariableName.get("V");
  private static final TypeName VOID = ClassName.get(Void.class);

  // Qualified names, sorted so the generated visitors are stable between builds.
  private final Set<String> astNodes = new TreeSet<>();
  private boolean visitorsWritten = false;

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
      if (!roundEnv.processingOver() && !annotations.isEmpty()) {
        processImpl(roundEnv);
        // Nodes are declared in the first round. Later rounds only see generated code.
        if (!astNodes.isEmpty() && !visitorsWritten) {
          writeVisitors();
          visitorsWritten = true;
        }
      }
    } catch (IOException ex) {
      processingEnv.getMessager().printMessage(Kind.ERROR, "Failed to write visitors: " + ex);
    }

    return true;
  }

  private void processImpl(RoundEnvironment roundEnv) {
    for (Element element : roundEnv.getElementsAnnotatedWith(ASTNode.class)) {
      TypeElement typeElement = (TypeElement) element;
      try {
        writeASTNodeFile(typeElement);
      } catch (IOException ex) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "APT Error: " + ex, typeElement);
      }
      astNodes.add(typeElement.getQualifiedName().toString());
    }
  }

  private static String getASTNodeInterfaceName(Element element) {
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

  private static MethodSpec.Builder visitorMethod(String name, TypeName visitorType) {
    return MethodSpec.methodBuilder(name)
        .addAnnotation(Override.class)
        .addModifiers(Modifier.PUBLIC, Modifier.DEFAULT)
        .addTypeVariable(V)
        .returns(V)
        .addParameter(ParameterizedTypeName.get(AST_VISITOR_NAME, V), "visitor")
        .addParameter(visitorType, "value");
  }

  private void writeASTNodeFile(TypeElement element) throws IOException {
    String interfaceName = getASTNodeInterfaceName(element);
    boolean implementsInterface =
        element
            .getInterfaces()
            .stream()
            .anyMatch(i -> TypeName.get(i).toString().endsWith(interfaceName));
    if (!implementsInterface) {
      processingEnv
          .getMessager()
          .printMessage(Kind.ERROR, "Missing interface: " + interfaceName, element);
      return;
    }

    TypeSpec.Builder nodeInterface =
        TypeSpec.interfaceBuilder(interfaceName)
            .addModifiers(Modifier.PUBLIC)
            .addSuperinterface(TREE_NODE_NAME);

    nodeInterface.addMethod(
        visitorMethod("accept", V)
            .addStatement("return visitor.visit(($T) this, value)", ClassName.get(element))
            .build());

    MethodSpec.Builder visitChildren = visitorMethod("visitChildren", V);
    for (Element enclosed : element.getEnclosedElements()) {
      if (enclosed.getKind() != ElementKind.METHOD) continue;
      if (enclosed.getAnnotation(ASTChild.class) == null) continue;
      if (enclosed.getAnnotation(Override.class) == null) {
        processingEnv.getMessager().printMessage(Kind.ERROR, "Missing @Override", enclosed);
      }

      ExecutableElement method = (ExecutableElement) enclosed;
      String methodName = method.getSimpleName().toString();
      nodeInterface.addMethod(
          MethodSpec.methodBuilder(methodName)
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(TypeName.get(method.getReturnType()))
              .build());
      visitChildren.addStatement(
          "value = $T.accept($L(), visitor, value)", TREE_NODES_NAME, methodName);
    }
    nodeInterface.addMethod(visitChildren.addStatement("return value").build());

    JavaFile.builder(PACKAGE, nodeInterface.build())
        .build()
        .writeTo(processingEnv.getFiler());
  }

  private void writeVisitors() throws IOException {
    TypeSpec.Builder visitor =
        TypeSpec.interfaceBuilder(AST_VISITOR_NAME).addTypeVariable(V);
    TypeSpec.Builder defaultVisitor =
        TypeSpec.classBuilder(DEFAULT_AST_VISITOR_NAME)
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .addTypeVariable(V)
            .addSuperinterface(ParameterizedTypeName.get(AST_VISITOR_NAME, V));
    TypeSpec.Builder voidVisitor =
        TypeSpec.classBuilder("VoidDefaultASTVisitor")
            .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
            .superclass(ParameterizedTypeName.get(DEFAULT_AST_VISITOR_NAME, VOID));

    for (String qualifiedName : astNodes) {
      ClassName node = ClassName.bestGuess(qualifiedName);
      visitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addModifiers(Modifier.PUBLIC, Modifier.ABSTRACT)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .build());
      defaultVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC)
              .returns(V)
              .addParameter(node, "node")
              .addParameter(V, "value")
              .addStatement("return node.visitChildren(this, value)")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visit")
              .addAnnotation(Override.class)
              .addModifiers(Modifier.PUBLIC, Modifier.FINAL)
              .returns(VOID)
              .addParameter(node, "node")
              .addParameter(VOID, "value")
              .addStatement("visitImpl(node)")
              .addStatement("return null")
              .build());
      voidVisitor.addMethod(
          MethodSpec.methodBuilder("visitImpl")
              .addModifiers(Modifier.PUBLIC)
              .addParameter(node, "node")
              .addStatement("node.visitChildren(this, null)")
              .build());
    }

    for (TypeSpec.Builder type : new TypeSpec.Builder[] {visitor, defaultVisitor, voidVisitor}) {
      JavaFile.builder(PACKAGE, type.build()).build().writeTo(processingEnv.getFiler());
    }
    processingEnv
        .getMessager()
        .printMessage(
            Kind.NOTE,
            astNodes.stream().collect(Collectors.joining(", ", "Generated visitors for: ", "")));
  }
}
