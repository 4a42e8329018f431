/*
 * Copyright 2021 The Circuit ASG Authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.circuitlang.asg;

import static com.circuitlang.asg.AsgConvertErrors.EXTRA_CIRCUIT_MEMBER;
import static com.circuitlang.asg.AsgConvertErrors.ILLEGAL_AST_STRUCTURE;
import static com.circuitlang.asg.AsgConvertErrors.ILLEGAL_STATIC_MEMBER_ACCESS;
import static com.circuitlang.asg.AsgConvertErrors.INDEX_OUT_OF_BOUNDS;
import static com.circuitlang.asg.AsgConvertErrors.INVALID_INT_VALUE;
import static com.circuitlang.asg.AsgConvertErrors.INVALID_LITERAL;
import static com.circuitlang.asg.AsgConvertErrors.MISSING_CIRCUIT_MEMBER;
import static com.circuitlang.asg.AsgConvertErrors.UNEXPECTED_TYPE;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_CIRCUIT;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_CIRCUIT_MEMBER;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_REFERENCE;
import static com.circuitlang.asg.AsgConvertErrors.UNRESOLVED_TYPE;

import com.circuitlang.ast.BinaryOperation;
import com.circuitlang.ast.ExpressionTree;
import com.circuitlang.ast.IntegerType;
import com.circuitlang.ast.Span;
import com.circuitlang.ast.UnaryOperation;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Converts syntax tree expressions into graph expressions.
 *
 * <p>Children are converted first, with a type hint derived from the context. The computed type
 * of every expression is checked against the hint it was converted under; the node is then
 * allocated and its direct children are pointed back at it.
 */
final class ExpressionConverter {
  private static final String ADDRESS_PREFIX = "aleo1";
  private static final int ADDRESS_LENGTH = 63;

  private final AsgContext context;
  private final CallResolver callResolver;

  ExpressionConverter(AsgContext context) {
    this.context = context;
    this.callResolver = new CallResolver(context, this);
  }

  Expression convert(Scope scope, ExpressionTree tree, @Nullable PartialType expected)
      throws AsgConvertException {
    if (tree instanceof ExpressionTree.Ident) {
      return convertIdent(scope, (ExpressionTree.Ident) tree, expected);
    } else if (tree instanceof ExpressionTree.Value) {
      return finish(expected, literal((ExpressionTree.Value) tree, expected, false));
    } else if (tree instanceof ExpressionTree.Binary) {
      return convertBinary(scope, (ExpressionTree.Binary) tree, expected);
    } else if (tree instanceof ExpressionTree.Unary) {
      return convertUnary(scope, (ExpressionTree.Unary) tree, expected);
    } else if (tree instanceof ExpressionTree.Ternary) {
      return convertTernary(scope, (ExpressionTree.Ternary) tree, expected);
    } else if (tree instanceof ExpressionTree.ArrayInline) {
      return convertArrayInline(scope, (ExpressionTree.ArrayInline) tree, expected);
    } else if (tree instanceof ExpressionTree.ArrayInit) {
      return convertArrayInit(scope, (ExpressionTree.ArrayInit) tree, expected);
    } else if (tree instanceof ExpressionTree.ArrayAccess) {
      return convertArrayAccess(scope, (ExpressionTree.ArrayAccess) tree, expected);
    } else if (tree instanceof ExpressionTree.TupleInit) {
      return convertTupleInit(scope, (ExpressionTree.TupleInit) tree, expected);
    } else if (tree instanceof ExpressionTree.TupleAccess) {
      return convertTupleAccess(scope, (ExpressionTree.TupleAccess) tree, expected);
    } else if (tree instanceof ExpressionTree.CircuitInit) {
      return convertCircuitInit(scope, (ExpressionTree.CircuitInit) tree, expected);
    } else if (tree instanceof ExpressionTree.MemberAccess) {
      return convertMemberAccess(scope, (ExpressionTree.MemberAccess) tree, expected);
    } else if (tree instanceof ExpressionTree.StaticAccess) {
      return convertStaticAccess(scope, (ExpressionTree.StaticAccess) tree, expected);
    } else if (tree instanceof ExpressionTree.Call) {
      return callResolver.resolve(scope, (ExpressionTree.Call) tree, expected);
    }
    throw AsgConvertException.of(tree.span(), ILLEGAL_AST_STRUCTURE, "unknown expression " + tree);
  }

  /** Checks {@code expression} against the hint, then allocates it and wires its children. */
  <T extends Expression> T finish(@Nullable PartialType expected, T expression)
      throws AsgConvertException {
    checkType(expected, expression.getType(), expression.getSpan());
    context.alloc(expression);
    expression.enforceParents();
    return expression;
  }

  static void checkType(@Nullable PartialType expected, Type actual, @Nullable Span span)
      throws AsgConvertException {
    if (expected != null && !expected.matches(actual)) {
      throw AsgConvertException.of(span, UNEXPECTED_TYPE, expected.toString(), actual.toString());
    }
  }

  private Expression convertIdent(
      Scope scope, ExpressionTree.Ident tree, @Nullable PartialType expected)
      throws AsgConvertException {
    String name = tree.identifier().name();
    Variable variable = scope.resolveVariable(name);
    if (variable == null) {
      throw AsgConvertException.of(tree.span(), UNRESOLVED_REFERENCE, name);
    }
    VariableRef ref = finish(expected, new VariableRef(context, tree.span(), variable));
    variable.addReference(ref);
    return ref;
  }

  /**
   * Builds the constant for a literal. Numbers without a suffix take their type from the hint.
   * {@code negated} folds a leading minus into the literal so that e.g. {@code -128i8} is in
   * range.
   */
  private Constant literal(
      ExpressionTree.Value tree, @Nullable PartialType expected, boolean negated)
      throws AsgConvertException {
    Span span = tree.span();
    String text = negated ? "-" + tree.text() : tree.text();
    switch (tree.kind()) {
      case BOOLEAN:
        if (tree.text().equals("true") || tree.text().equals("false")) {
          return new Constant(context, span, new ConstValue.Bool(tree.text().equals("true")));
        }
        throw AsgConvertException.of(span, INVALID_LITERAL, "bool", tree.text());
      case ADDRESS:
        if (!tree.text().startsWith(ADDRESS_PREFIX) || tree.text().length() != ADDRESS_LENGTH) {
          throw AsgConvertException.of(span, INVALID_LITERAL, "address", tree.text());
        }
        return new Constant(context, span, new ConstValue.Address(tree.text()));
      case CHAR:
        if (tree.text().isEmpty() || tree.text().codePointCount(0, tree.text().length()) != 1) {
          throw AsgConvertException.of(span, INVALID_LITERAL, "char", tree.text());
        }
        return new Constant(context, span, new ConstValue.Char(tree.text().codePointAt(0)));
      case FIELD:
        return new Constant(context, span, new ConstValue.Field(parseNumber(text, "field", span)));
      case GROUP:
        return new Constant(context, span, new ConstValue.Group(text));
      case INTEGER:
        IntegerType integerType = tree.integerType();
        if (integerType == null) {
          throw AsgConvertException.of(span, ILLEGAL_AST_STRUCTURE, "integer literal without type");
        }
        return integer(text, integerType, span);
      case IMPLICIT:
        return implicit(text, expected, span);
    }
    throw AsgConvertException.of(span, ILLEGAL_AST_STRUCTURE, "unknown literal " + tree);
  }

  private Constant implicit(String text, @Nullable PartialType expected, @Nullable Span span)
      throws AsgConvertException {
    if (expected == null) {
      throw AsgConvertException.of(span, UNRESOLVED_TYPE, "literal `" + text + "`");
    }
    if (expected instanceof PartialType.IntegerHint) {
      IntegerType integerType = ((PartialType.IntegerHint) expected).literalType();
      if (integerType == null) {
        throw AsgConvertException.of(span, UNRESOLVED_TYPE, "literal `" + text + "`");
      }
      return integer(text, integerType, span);
    }
    Type type = expected.full();
    if (type instanceof Type.Int) {
      return integer(text, ((Type.Int) type).integerType(), span);
    } else if (Type.FIELD.equals(type)) {
      return new Constant(context, span, new ConstValue.Field(parseNumber(text, "field", span)));
    } else if (Type.GROUP.equals(type)) {
      return new Constant(context, span, new ConstValue.Group(text));
    }
    throw AsgConvertException.of(span, UNEXPECTED_TYPE, expected.toString(), "integer");
  }

  private Constant integer(String text, IntegerType integerType, @Nullable Span span)
      throws AsgConvertException {
    BigInteger value;
    try {
      value = new BigInteger(text);
    } catch (NumberFormatException e) {
      throw AsgConvertException.of(span, INVALID_INT_VALUE, text, integerType.keyword());
    }
    if (!integerType.contains(value)) {
      throw AsgConvertException.of(span, INVALID_INT_VALUE, text, integerType.keyword());
    }
    return new Constant(context, span, new ConstValue.Int(integerType, value));
  }

  private static BigInteger parseNumber(String text, String kind, @Nullable Span span)
      throws AsgConvertException {
    try {
      return new BigInteger(text);
    } catch (NumberFormatException e) {
      throw AsgConvertException.of(span, INVALID_LITERAL, kind, text);
    }
  }

  /**
   * Converts two operands that must have the same type. The first is converted under
   * {@code hint} and its type becomes the hint of the second; when only the first needs a hint
   * to be typed, the order is reversed.
   */
  private Expression[] convertPair(
      Scope scope, ExpressionTree first, ExpressionTree second, @Nullable PartialType hint)
      throws AsgConvertException {
    if (needsHint(first) && !needsHint(second)) {
      Expression b = convert(scope, second, hint);
      return new Expression[] {convert(scope, first, b.getType().partial()), b};
    }
    Expression a = convert(scope, first, hint);
    return new Expression[] {a, convert(scope, second, a.getType().partial())};
  }

  /** Whether {@code tree} holds an untyped literal that takes its type from the context. */
  static boolean needsHint(ExpressionTree tree) {
    if (tree instanceof ExpressionTree.Value) {
      return ((ExpressionTree.Value) tree).kind() == ExpressionTree.ValueKind.IMPLICIT;
    } else if (tree instanceof ExpressionTree.Unary) {
      return needsHint(((ExpressionTree.Unary) tree).inner());
    } else if (tree instanceof ExpressionTree.Binary) {
      ExpressionTree.Binary binary = (ExpressionTree.Binary) tree;
      return !binary.operation().producesBoolean()
          && needsHint(binary.left())
          && needsHint(binary.right());
    } else if (tree instanceof ExpressionTree.Ternary) {
      ExpressionTree.Ternary ternary = (ExpressionTree.Ternary) tree;
      return needsHint(ternary.ifTrue()) && needsHint(ternary.ifFalse());
    } else if (tree instanceof ExpressionTree.TupleInit) {
      for (ExpressionTree element : ((ExpressionTree.TupleInit) tree).elements()) {
        if (needsHint(element)) {
          return true;
        }
      }
      return false;
    } else if (tree instanceof ExpressionTree.ArrayInline) {
      for (ExpressionTree.ArrayElement element : ((ExpressionTree.ArrayInline) tree).elements()) {
        if (needsHint(element.expression())) {
          return true;
        }
      }
      return false;
    } else if (tree instanceof ExpressionTree.ArrayInit) {
      return needsHint(((ExpressionTree.ArrayInit) tree).element());
    }
    return false;
  }

  private Expression convertBinary(
      Scope scope, ExpressionTree.Binary tree, @Nullable PartialType expected)
      throws AsgConvertException {
    BinaryOperation operation = tree.operation();
    Expression[] operands;
    switch (operation.operationClass()) {
      case BOOLEAN:
        operands =
            new Expression[] {
              convert(scope, tree.left(), Type.BOOLEAN.partial()),
              convert(scope, tree.right(), Type.BOOLEAN.partial())
            };
        break;
      case NUMERIC:
        operands = convertPair(scope, tree.left(), tree.right(), expected);
        if (!isArithmetic(operation, operands[0].getType())) {
          throw AsgConvertException.of(
              tree.span(),
              UNEXPECTED_TYPE,
              arithmeticTypes(operation),
              operands[0].getType().toString());
        }
        break;
      case ORDERING:
        operands = convertPair(scope, tree.left(), tree.right(), null);
        Type operandType = operands[0].getType();
        if (!operandType.isInteger() && !operandType.equals(Type.FIELD)) {
          throw AsgConvertException.of(
              tree.span(), UNEXPECTED_TYPE, "integer or field", operandType.toString());
        }
        break;
      case EQUALITY:
        operands = convertPair(scope, tree.left(), tree.right(), null);
        break;
      default:
        throw new IllegalStateException("unexpected operation " + operation);
    }
    Type type = operation.producesBoolean() ? Type.BOOLEAN : operands[0].getType();
    return finish(
        expected,
        new BinaryExpression(context, tree.span(), operation, operands[0], operands[1], type));
  }

  /** Whether {@code operation} is defined on operands of {@code type}. */
  static boolean isArithmetic(BinaryOperation operation, Type type) {
    if (type.isInteger()) {
      return true;
    } else if (type.equals(Type.FIELD)) {
      return operation != BinaryOperation.POW;
    } else if (type.equals(Type.GROUP)) {
      return operation == BinaryOperation.ADD || operation == BinaryOperation.SUB;
    }
    return false;
  }

  static String arithmeticTypes(BinaryOperation operation) {
    switch (operation) {
      case ADD:
      case SUB:
        return "integer, field or group";
      case POW:
        return "integer";
      default:
        return "integer or field";
    }
  }

  private Expression convertUnary(
      Scope scope, ExpressionTree.Unary tree, @Nullable PartialType expected)
      throws AsgConvertException {
    if (tree.operation() == UnaryOperation.NOT) {
      Expression inner = convert(scope, tree.inner(), Type.BOOLEAN.partial());
      return finish(
          expected, new UnaryExpression(context, tree.span(), UnaryOperation.NOT, inner));
    }
    if (tree.inner() instanceof ExpressionTree.Value) {
      ExpressionTree.Value value = (ExpressionTree.Value) tree.inner();
      if (isNumericLiteral(value)) {
        return finish(expected, literal(value, expected, true));
      }
    }
    Expression inner = convert(scope, tree.inner(), expected);
    Type type = inner.getType();
    boolean negatable =
        (type instanceof Type.Int && ((Type.Int) type).integerType().isSigned())
            || type.equals(Type.FIELD)
            || type.equals(Type.GROUP);
    if (!negatable) {
      throw AsgConvertException.of(
          tree.span(), UNEXPECTED_TYPE, "signed integer, field or group", type.toString());
    }
    return finish(
        expected, new UnaryExpression(context, tree.span(), UnaryOperation.NEGATE, inner));
  }

  private static boolean isNumericLiteral(ExpressionTree.Value value) {
    switch (value.kind()) {
      case FIELD:
      case GROUP:
      case IMPLICIT:
      case INTEGER:
        return !value.text().startsWith("-") && !value.text().startsWith("(");
      default:
        return false;
    }
  }

  private Expression convertTernary(
      Scope scope, ExpressionTree.Ternary tree, @Nullable PartialType expected)
      throws AsgConvertException {
    Expression condition = convert(scope, tree.condition(), Type.BOOLEAN.partial());
    Expression[] branches = convertPair(scope, tree.ifTrue(), tree.ifFalse(), expected);
    return finish(
        expected, new TernaryExpression(context, tree.span(), condition, branches[0], branches[1]));
  }

  /** The element hint of an array hint, or null. Fails if the hint is not an array. */
  private static @Nullable PartialType elementHint(
      @Nullable PartialType expected, @Nullable Span span) throws AsgConvertException {
    if (expected == null) {
      return null;
    } else if (expected instanceof PartialType.ArrayHint) {
      return ((PartialType.ArrayHint) expected).element();
    }
    Type type = expected.full();
    if (type instanceof Type.Array) {
      return ((Type.Array) type).element().partial();
    }
    throw AsgConvertException.of(span, UNEXPECTED_TYPE, expected.toString(), "array");
  }

  private Expression convertArrayInline(
      Scope scope, ExpressionTree.ArrayInline tree, @Nullable PartialType expected)
      throws AsgConvertException {
    PartialType elementHint = elementHint(expected, tree.span());
    Type elementType = elementHint == null ? null : elementHint.full();
    List<Expression> elements = new ArrayList<>();
    List<Boolean> spread = new ArrayList<>();
    int length = 0;
    for (ExpressionTree.ArrayElement element : tree.elements()) {
      PartialType hint = elementType != null ? elementType.partial() : elementHint;
      if (element.spread()) {
        Expression array =
            convert(scope, element.expression(), new PartialType.ArrayHint(hint, null));
        Type.Array arrayType = (Type.Array) array.getType();
        elementType = arrayType.element();
        length += arrayType.length();
        elements.add(array);
      } else {
        Expression value = convert(scope, element.expression(), hint);
        elementType = value.getType();
        length++;
        elements.add(value);
      }
      spread.add(element.spread());
    }
    if (elementType == null) {
      throw AsgConvertException.of(tree.span(), UNRESOLVED_TYPE, "empty array");
    }
    return finish(
        expected,
        new ArrayInlineExpression(
            context, tree.span(), elements, spread, new Type.Array(elementType, length)));
  }

  private Expression convertArrayInit(
      Scope scope, ExpressionTree.ArrayInit tree, @Nullable PartialType expected)
      throws AsgConvertException {
    if (tree.length() < 0) {
      throw AsgConvertException.of(
          tree.span(), ILLEGAL_AST_STRUCTURE, "negative array length " + tree.length());
    }
    Expression element = convert(scope, tree.element(), elementHint(expected, tree.span()));
    return finish(expected, new ArrayInitExpression(context, tree.span(), element, tree.length()));
  }

  private Expression convertArrayAccess(
      Scope scope, ExpressionTree.ArrayAccess tree, @Nullable PartialType expected)
      throws AsgConvertException {
    Expression array = convert(scope, tree.array(), new PartialType.ArrayHint(expected, null));
    Type.Array arrayType = (Type.Array) array.getType();
    Expression index =
        convert(scope, tree.index(), new PartialType.IntegerHint(null, IntegerType.U32));
    ConstValue position = index.constValue();
    if (position instanceof ConstValue.Int) {
      BigInteger value = ((ConstValue.Int) position).value();
      if (value.signum() < 0 || value.compareTo(BigInteger.valueOf(arrayType.length())) >= 0) {
        throw AsgConvertException.of(
            tree.index().span(),
            INDEX_OUT_OF_BOUNDS,
            value.toString(),
            arrayType.toString(),
            String.valueOf(arrayType.length()));
      }
    }
    return finish(expected, new ArrayAccessExpression(context, tree.span(), array, index));
  }

  private Expression convertTupleInit(
      Scope scope, ExpressionTree.TupleInit tree, @Nullable PartialType expected)
      throws AsgConvertException {
    List<PartialType> hints = null;
    if (expected != null) {
      PartialType hint = expected;
      Type type = expected.full();
      if (type instanceof Type.Tuple) {
        hint = type.partial();
      }
      if (!(hint instanceof PartialType.TupleHint)
          || ((PartialType.TupleHint) hint).elements().size() != tree.elements().size()) {
        throw AsgConvertException.of(
            tree.span(),
            UNEXPECTED_TYPE,
            expected.toString(),
            "tuple of " + tree.elements().size());
      }
      hints = ((PartialType.TupleHint) hint).elements();
    }
    List<Expression> elements = new ArrayList<>();
    for (int i = 0; i < tree.elements().size(); i++) {
      elements.add(convert(scope, tree.elements().get(i), hints == null ? null : hints.get(i)));
    }
    return finish(expected, new TupleInitExpression(context, tree.span(), elements));
  }

  private Expression convertTupleAccess(
      Scope scope, ExpressionTree.TupleAccess tree, @Nullable PartialType expected)
      throws AsgConvertException {
    Expression tuple = convert(scope, tree.tuple(), null);
    if (!(tuple.getType() instanceof Type.Tuple)) {
      throw AsgConvertException.of(
          tree.span(), UNEXPECTED_TYPE, "tuple", tuple.getType().toString());
    }
    Type.Tuple tupleType = (Type.Tuple) tuple.getType();
    if (tree.index() < 0 || tree.index() >= tupleType.elements().size()) {
      throw AsgConvertException.of(
          tree.span(),
          INDEX_OUT_OF_BOUNDS,
          String.valueOf(tree.index()),
          tupleType.toString(),
          String.valueOf(tupleType.elements().size()));
    }
    return finish(expected, new TupleAccessExpression(context, tree.span(), tuple, tree.index()));
  }

  private Expression convertCircuitInit(
      Scope scope, ExpressionTree.CircuitInit tree, @Nullable PartialType expected)
      throws AsgConvertException {
    String name = tree.name().name();
    Circuit circuit = scope.resolveCircuit(name);
    if (circuit == null) {
      throw AsgConvertException.of(tree.name().span(), UNRESOLVED_CIRCUIT, name);
    }
    Map<String, Expression> values = new LinkedHashMap<>();
    for (ExpressionTree.MemberInit init : tree.members()) {
      String member = init.name().name();
      CircuitMember field = circuit.getMember(member);
      if (!(field instanceof CircuitMember.Field) || values.containsKey(member)) {
        throw AsgConvertException.of(
            init.name().span(), EXTRA_CIRCUIT_MEMBER, circuit.getName(), member);
      }
      ExpressionTree value =
          init.expression() != null ? init.expression() : new ExpressionTree.Ident(init.name());
      values.put(member, convert(scope, value, ((CircuitMember.Field) field).type().partial()));
    }
    for (CircuitMember.Field field : circuit.getFields()) {
      if (!values.containsKey(field.name())) {
        throw AsgConvertException.of(
            tree.span(), MISSING_CIRCUIT_MEMBER, circuit.getName(), field.name());
      }
    }
    return finish(expected, new CircuitInitExpression(context, tree.span(), circuit, values));
  }

  private Expression convertMemberAccess(
      Scope scope, ExpressionTree.MemberAccess tree, @Nullable PartialType expected)
      throws AsgConvertException {
    Expression target = convert(scope, tree.circuit(), null);
    Circuit circuit = circuitOf(target, tree.span());
    CircuitMember member = member(circuit, tree.name().name(), tree.span());
    return finish(
        expected, new CircuitAccessExpression(context, tree.span(), circuit, target, member));
  }

  private Expression convertStaticAccess(
      Scope scope, ExpressionTree.StaticAccess tree, @Nullable PartialType expected)
      throws AsgConvertException {
    Circuit circuit = staticCircuit(scope, tree.circuit(), tree.span());
    CircuitMember member = member(circuit, tree.name().name(), tree.span());
    if (!(member instanceof CircuitMember.Method)
        || !((CircuitMember.Method) member).function().isStatic()) {
      throw AsgConvertException.of(
          tree.span(), ILLEGAL_STATIC_MEMBER_ACCESS, circuit.getName(), member.name());
    }
    return finish(
        expected, new CircuitAccessExpression(context, tree.span(), circuit, null, member));
  }

  /** The circuit of a member access target; fails if the target is not a circuit value. */
  static Circuit circuitOf(Expression target, @Nullable Span span) throws AsgConvertException {
    if (!(target.getType() instanceof Type.CircuitRef)) {
      throw AsgConvertException.of(span, UNEXPECTED_TYPE, "circuit", target.getType().toString());
    }
    return ((Type.CircuitRef) target.getType()).circuit();
  }

  /** Resolves the bare circuit name on the left of {@code ::}. */
  static Circuit staticCircuit(Scope scope, ExpressionTree tree, @Nullable Span span)
      throws AsgConvertException {
    if (!(tree instanceof ExpressionTree.Ident)) {
      throw AsgConvertException.of(span, UNEXPECTED_TYPE, "circuit", tree.toString());
    }
    ExpressionTree.Ident ident = (ExpressionTree.Ident) tree;
    Circuit circuit = scope.resolveCircuit(ident.identifier().name());
    if (circuit == null) {
      throw AsgConvertException.of(ident.span(), UNRESOLVED_CIRCUIT, ident.identifier().name());
    }
    return circuit;
  }

  static CircuitMember member(Circuit circuit, String name, @Nullable Span span)
      throws AsgConvertException {
    CircuitMember member = circuit.getMember(name);
    if (member == null) {
      throw AsgConvertException.of(span, UNRESOLVED_CIRCUIT_MEMBER, circuit.getName(), name);
    }
    return member;
  }
}
