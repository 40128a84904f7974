package ca.gc.cra.certifai.infrastructure.java;

import ca.gc.cra.certifai.annotation.Certifai;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import java.util.ArrayList;
import java.util.List;

/**
 * Recognises the provenance annotation and its nested reviewer annotation in parsed source.
 */
final class CertifaiAnnotations {
  static final String SIMPLE_NAME = Certifai.class.getSimpleName();
  static final String QUALIFIED_NAME = Certifai.class.getCanonicalName();
  static final String REVIEWER_SIMPLE_NAME = Certifai.Reviewer.class.getSimpleName();
  static final String REVIEWER_NAME = SIMPLE_NAME + "." + REVIEWER_SIMPLE_NAME;
  static final String PACKAGE_NAME = Certifai.class.getPackageName();

  private CertifaiAnnotations() {}

  static boolean isCertifai(AnnotationExpr annotation) {
    String name = annotation.getNameAsString();
    return SIMPLE_NAME.equals(name) || QUALIFIED_NAME.equals(name);
  }

  static boolean isReviewer(AnnotationExpr annotation) {
    String name = annotation.getNameAsString();
    return REVIEWER_SIMPLE_NAME.equals(name)
        || REVIEWER_NAME.equals(name)
        || (QUALIFIED_NAME + "." + REVIEWER_SIMPLE_NAME).equals(name);
  }

  static List<AnnotationExpr> find(NodeWithAnnotations<?> declaration) {
    List<AnnotationExpr> found = new ArrayList<>(1);
    for (AnnotationExpr annotation : declaration.getAnnotations()) {
      if (isCertifai(annotation)) {
        found.add(annotation);
      }
    }
    return found;
  }

  /**
   * Indicates whether the simple name {@code Certifai} resolves to the annotation type in a compilation unit.
   *
   * @param unit parsed compilation unit
   * @return {@code true} when imported (single-type or on demand) or declared in the same package
   */
  static boolean isImported(CompilationUnit unit) {
    boolean samePackage = unit.getPackageDeclaration()
        .map(pkg -> PACKAGE_NAME.equals(pkg.getNameAsString()))
        .orElse(false);
    if (samePackage) {
      return true;
    }
    for (ImportDeclaration declaration : unit.getImports()) {
      if (declaration.isStatic()) {
        continue;
      }
      String name = declaration.getNameAsString();
      if (declaration.isAsterisk() ? PACKAGE_NAME.equals(name) : QUALIFIED_NAME.equals(name)) {
        return true;
      }
    }
    return false;
  }
}
