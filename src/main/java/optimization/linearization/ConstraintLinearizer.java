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

import java.util.List;

import expressions.Node;

/**
 * Interface for linearizers that rewrite boolean expressions (that cannot be posted directly) into linear comparisons.
 * Each implementation handles a specific family of expressions.
 */
public interface ConstraintLinearizer {

    /**
     * Check if this linearizer can handle the given expression.
     *
     * @param node the expression to check
     * @return true if this linearizer can linearize the expression
     */
    boolean canLinearize(Node node);

    /**
     * Linearize the expression into comparisons that can be posted as solver constraints.
     * Called only after canLinearize() returns true.
     *
     * @param node the expression to linearize
     * @param ctx the linearization context providing auxiliary variables and constants
     * @return the comparisons, in the order they must be posted
     */
    List<Node> linearize(Node node, LinearizationContext ctx);
}
