package ca.gc.cra.certifai.infrastructure.java;

import com.github.javaparser.ast.Modifier;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.NodeList;
import com.github.javaparser.ast.body.BodyDeclaration;
import com.github.javaparser.ast.body.CallableDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.InitializerDeclaration;
import com.github.javaparser.ast.body.TypeDeclaration;
import com.github.javaparser.ast.comments.Comment;
import com.github.javaparser.ast.expr.AnnotationExpr;
import com.github.javaparser.ast.expr.MemberValuePair;
import com.github.javaparser.ast.expr.NormalAnnotationExpr;
import com.github.javaparser.ast.nodeTypes.NodeWithAnnotations;
import com.github.javaparser.ast.nodeTypes.NodeWithModifiers;
import com.github.javaparser.printer.Printer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Computes the canonical digest of a declaration.
 *
 * <p>The declaration is cloned, stripped of comments, Javadoc and every {@code @Certifai} annotation in its
 * subtree, and its order-irrelevant parts are sorted: modifiers, annotations, named annotation members,
 * {@code throws} lists, and the methods, constructors and nested types of a type body. Fields and initializers
 * keep their relative order. The clone is pretty-printed and the UTF-8 bytes are hashed with SHA-256.</p>
 *
 * <p>Thread-safe; every call works on its own clone and printer.</p>
 */
public final class CanonicalDigester {
  private static final String ALGORITHM = "SHA-256";

  /**
   * Digests a declaration.
   *
   * @param declaration parsed declaration; left unmodified
   * @return lowercase hex SHA-256 of the canonical form
   */
  public String digest(BodyDeclaration<?> declaration) {
    return hash(canonicalForm(declaration));
  }

  /**
   * Renders the canonical text of a declaration.
   *
   * @param declaration parsed declaration; left unmodified
   * @return canonical source text
   */
  public String canonicalForm(BodyDeclaration<?> declaration) {
    BodyDeclaration<?> copy = declaration.clone();
    Printer printer = JavaParsers.canonicalPrinter();
    stripComments(copy);
    stripProvenance(copy);
    for (Node node : copy.findAll(Node.class)) {
      if (node instanceof NodeWithModifiers<?> withModifiers) {
        reorder(withModifiers.getModifiers(), Comparator.comparing(Modifier::getKeyword));
      }
      if (node instanceof NormalAnnotationExpr annotation) {
        reorder(annotation.getPairs(), Comparator.comparing(MemberValuePair::getNameAsString));
      }
    }
    for (Node node : copy.findAll(Node.class)) {
      if (node instanceof NodeWithAnnotations<?> withAnnotations) {
        reorder(withAnnotations.getAnnotations(), Comparator.comparing(printer::print));
      }
      if (node instanceof CallableDeclaration<?> callable) {
        reorder(callable.getThrownExceptions(), Comparator.comparing(printer::print));
      }
    }
    List<TypeDeclaration<?>> types = new ArrayList<>();
    for (Node node : copy.findAll(Node.class)) {
      if (node instanceof TypeDeclaration<?> type) {
        types.add(type);
      }
    }
    Collections.reverse(types);
    for (TypeDeclaration<?> type : types) {
      sortMembers(type, printer);
    }
    return printer.print(copy);
  }

  private static void stripComments(Node node) {
    for (Comment comment : node.getAllContainedComments()) {
      comment.remove();
    }
    node.getComment().ifPresent(Comment::remove);
  }

  private static void stripProvenance(Node node) {
    for (AnnotationExpr annotation : node.findAll(AnnotationExpr.class)) {
      if (CertifaiAnnotations.isCertifai(annotation)) {
        annotation.remove();
      }
    }
  }

  private static void sortMembers(TypeDeclaration<?> type, Printer printer) {
    NodeList<BodyDeclaration<?>> members = type.getMembers();
    if (members.size() < 2) {
      return;
    }
    List<BodyDeclaration<?>> ordered = new ArrayList<>();
    List<BodyDeclaration<?>> unordered = new ArrayList<>();
    for (BodyDeclaration<?> member : members) {
      if (member instanceof FieldDeclaration || member instanceof InitializerDeclaration) {
        ordered.add(member);
      } else {
        unordered.add(member);
      }
    }
    unordered.sort(Comparator.comparing(printer::print));
    List<BodyDeclaration<?>> canonical = new ArrayList<>(ordered);
    canonical.addAll(unordered);
    members.clear();
    members.addAll(canonical);
  }

  private static <N extends Node> void reorder(NodeList<N> list, Comparator<? super N> order) {
    if (list.size() < 2) {
      return;
    }
    List<N> sorted = new ArrayList<>(list);
    sorted.sort(order);
    list.clear();
    list.addAll(sorted);
  }

  private static String hash(String canonical) {
    try {
      MessageDigest digest = MessageDigest.getInstance(ALGORITHM);
      return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException(ALGORITHM + " unavailable", ex);
    }
  }
}
