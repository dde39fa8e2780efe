/*
 * This file is part of the constraint generation planner CGP.
 *
 * Copyright (c) 2021. All rights reserved.
 * Christophe Lecoutre, CRIL, Univ. Artois and CNRS.
 *
 * Licensed under the MIT License.
 * See LICENSE file in the project root for full license information.
 */

package optimization.linearization;

import static expressions.Operator.ADD;
import static expressions.Operator.LE;
import static expressions.Operator.MUL;
import static expressions.Operator.SUB;

import java.util.ArrayList;
import java.util.List;

import expressions.Kind;
import expressions.Node;
import expressions.Operator;
import expressions.ParseException;
import solver.SolverVariable;

/**
 * Linearizer for disjunctions of comparisons, using the big-M method.
 *
 * Each disjunct i receives a 0/1 indicator aux_i such that aux_i = 0 forces the comparison, and aux_i = 1 forces its negation.
 * After normalization (E1 > E2 becomes E2 < E1, and E1 >= E2 becomes E2 <= E1):
 * - E1 <= E2: E2 + tol - M + aux_i*M <= E1 and E1 <= E2 + aux_i*M
 * - E1 < E2: E2 + aux_i*M - M <= E1 and E1 <= E2 + aux_i*M - tol
 * Finally, sum(aux_i) <= n - 1 ensures that at least one disjunct holds.
 */
public class DisjunctionLinearizer implements ConstraintLinearizer {

    @Override
    public boolean canLinearize(Node node) {
        return node.kind == Kind.OR;
    }

    @Override
    public List<Node> linearize(Node node, LinearizationContext ctx) {
        List<Node> list = new ArrayList<>();
        List<Node> indicators = new ArrayList<>();
        for (Node disjunct : node.children()) {
            if (disjunct.kind != Kind.COMPARE || !disjunct.operator.isOrdering())
                throw new ParseException("Disjunctions can only involve comparisons with <, <=, > or >=: " + disjunct);
            SolverVariable aux = ctx.nextAuxiliary();
            Node indicator = Node.name(aux.name);
            indicators.add(indicator);
            addBigM(disjunct, indicator, ctx, list);
        }
        list.add(Node.compare(LE, sum(indicators), Node.number(indicators.size() - 1)));
        return list;
    }

    private static Node add(Node left, Node right) {
        return Node.binary(ADD, left, right);
    }

    private static Node sub(Node left, Node right) {
        return Node.binary(SUB, left, right);
    }

    private static Node sum(List<Node> nodes) {
        Node sum = nodes.get(0);
        for (int i = 1; i < nodes.size(); i++)
            sum = add(sum, nodes.get(i));
        return sum;
    }

    private void addBigM(Node comparison, Node aux, LinearizationContext ctx, List<Node> list) {
        boolean swap = comparison.operator == Operator.GT || comparison.operator == Operator.GE;
        Node e1 = swap ? comparison.right() : comparison.left();
        Node e2 = swap ? comparison.left() : comparison.right();
        boolean strict = comparison.operator == Operator.LT || comparison.operator == Operator.GT;
        Node bigM = Node.number(ctx.bigM()), tol = Node.number(ctx.tolerance());
        Node auxM = Node.binary(MUL, aux, bigM);
        if (strict) {
            list.add(Node.compare(LE, sub(add(e2, auxM), bigM), e1));
            list.add(Node.compare(LE, e1, sub(add(e2, auxM), tol)));
        } else {
            list.add(Node.compare(LE, add(sub(add(e2, tol), bigM), auxM), e1));
            list.add(Node.compare(LE, e1, add(e2, auxM)));
        }
    }
}
