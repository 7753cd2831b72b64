/* 
 * Copyright (C) 2025 Jean Ollion
 *
 * This File is part of STORMCELL
 *
 * STORMCELL is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * STORMCELL is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with STORMCELL.  If not, see <http://www.gnu.org/licenses/>.
 */
package stormcell.processing.matching;

import org.jgrapht.alg.interfaces.MatchingAlgorithm;
import org.jgrapht.alg.matching.KuhnMunkresMinimalWeightBipartitePerfectMatching;
import org.jgrapht.graph.DefaultWeightedEdge;
import org.jgrapht.graph.SimpleWeightedGraph;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Exact assignment: the cost matrix is padded to a square matrix with zero-cost dummy rows / columns
 * and solved as a minimal weight perfect matching of the complete bipartite graph
 * @author Jean Ollion
 */
public class KuhnMunkresAssignmentSolver implements AssignmentSolver {

    @Override
    public int[] solve(double[][] cost) {
        int rows = cost.length;
        int cols = cost[0].length;
        int n = Math.max(rows, cols);
        // vertices 0..n-1: rows, n..2n-1: columns
        SimpleWeightedGraph<Integer, DefaultWeightedEdge> graph = new SimpleWeightedGraph<>(DefaultWeightedEdge.class);
        Set<Integer> rowVertices = new HashSet<>(), colVertices = new HashSet<>();
        for (int i = 0; i<n; ++i) {
            graph.addVertex(i);
            rowVertices.add(i);
            graph.addVertex(n + i);
            colVertices.add(n + i);
        }
        for (int i = 0; i<n; ++i) {
            for (int j = 0; j<n; ++j) {
                DefaultWeightedEdge e = graph.addEdge(i, n + j);
                double w = i<rows && j<cols ? cost[i][j] : 0;
                if (!Double.isFinite(w)) throw new IllegalArgumentException("Non finite cost at ["+i+";"+j+"]");
                graph.setEdgeWeight(e, w);
            }
        }
        MatchingAlgorithm.Matching<Integer, DefaultWeightedEdge> matching = new KuhnMunkresMinimalWeightBipartitePerfectMatching<>(graph, rowVertices, colVertices).getMatching();
        int[] res = new int[rows];
        Arrays.fill(res, -1);
        for (DefaultWeightedEdge e : matching.getEdges()) {
            int s = graph.getEdgeSource(e);
            int t = graph.getEdgeTarget(e);
            int row = Math.min(s, t);
            int col = Math.max(s, t) - n;
            if (row<rows && col<cols) res[row] = col;
        }
        return res;
    }
}
