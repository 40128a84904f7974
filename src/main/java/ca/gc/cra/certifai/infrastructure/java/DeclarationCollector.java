package ca.gc.cra.certifai.infrastructure.java;

import ca.gc.cra.certifai.domain.model.ArtifactKind;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists the trackable declarations of a compilation unit with their qualified names.
 *
 * <p>Top-level and member types, methods and constructors are collected in source order. Declarations inside
 * method bodies (local and anonymous classes), enum constant bodies and compact record constructors are not
 * tracked.</p>
 */
final class DeclarationCollector {

  record Declaration(BodyDeclaration<?> node, ArtifactKind kind, String qualifiedName) {}

  List<Declaration> collect(CompilationUnit unit) {
    String prefix = unit.getPackageDeclaration().map(pkg -> pkg.getNameAsString()).orElse("");
    List<Declaration> found = new ArrayList<>();
    for (TypeDeclaration<?> type : unit.getTypes()) {
      collectType(type, prefix, found);
    }
    return found;
  }

  private void collectType(TypeDeclaration<?> type, String prefix, List<Declaration> found) {
    String qualified = prefix.isEmpty() ? type.getNameAsString() : prefix + "." + type.getNameAsString();
    found.add(new Declaration(type, kindOf(type), qualified));
    for (BodyDeclaration<?> member : type.getMembers()) {
      if (member instanceof TypeDeclaration<?> nested) {
        collectType(nested, qualified, found);
      } else if (member instanceof MethodDeclaration method) {
        found.add(new Declaration(method, ArtifactKind.METHOD, qualified + "." + method.getSignature().asString()));
      } else if (member instanceof ConstructorDeclaration constructor) {
        found.add(new Declaration(constructor, ArtifactKind.CONSTRUCTOR,
            qualified + "." + constructor.getSignature().asString()));
      }
    }
  }

  private static ArtifactKind kindOf(TypeDeclaration<?> type) {
    if (type instanceof ClassOrInterfaceDeclaration declaration) {
      return declaration.isInterface() ? ArtifactKind.INTERFACE : ArtifactKind.CLASS;
    }
    if (type instanceof EnumDeclaration) {
      return ArtifactKind.ENUM;
    }
    if (type instanceof RecordDeclaration) {
      return ArtifactKind.RECORD;
    }
    if (type instanceof AnnotationDeclaration) {
      return ArtifactKind.ANNOTATION;
    }
    return ArtifactKind.CLASS;
  }
}
