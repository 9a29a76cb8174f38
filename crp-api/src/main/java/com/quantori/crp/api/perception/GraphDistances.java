package com.quantori.crp.api.perception;

import com.quantori.crp.api.model.Atom;
import com.quantori.crp.api.model.MolecularGraph;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Topological distances between atoms, computed by breadth first search and cached per source atom.
 */
public class GraphDistances {

  private final MolecularGraph graph;
  private final Map<Integer, Map<Integer, Integer>> cache = new HashMap<>();

  public GraphDistances(MolecularGraph graph) {
    this.graph = graph;
  }

  /**
   * Number of bonds on a shortest path between two atoms, -1 if they are not connected.
   */
  public int bondDistance(int fromAtom, int toAtom) {
    return cache.computeIfAbsent(fromAtom, this::search).getOrDefault(toAtom, -1);
  }

  /**
   * Number of atoms on a shortest path between two atoms including both ends, -1 if they are not connected.
   */
  public int atomDistance(int fromAtom, int toAtom) {
    int bonds = bondDistance(fromAtom, toAtom);
    return bonds < 0 ? -1 : bonds + 1;
  }

  private Map<Integer, Integer> search(int source) {
    Map<Integer, Integer> distances = new HashMap<>();
    distances.put(source, 0);
    Deque<Integer> queue = new ArrayDeque<>();
    queue.add(source);
    while (!queue.isEmpty()) {
      int current = queue.poll();
      for (Atom neighbor : graph.getNeighbors(current)) {
        if (!distances.containsKey(neighbor.getId())) {
          distances.put(neighbor.getId(), distances.get(current) + 1);
          queue.add(neighbor.getId());
        }
      }
    }
    return distances;
  }
}
