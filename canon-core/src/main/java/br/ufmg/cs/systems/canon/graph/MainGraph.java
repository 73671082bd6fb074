package br.ufmg.cs.systems.canon.graph;

import com.koloboke.function.IntIntConsumer;

/**
 * Immutable simple undirected graph. Vertices carry non-negative integer ids
 * and are also addressed by position: the index of the id in ascending id
 * order. Every engine-facing method works on positions.
 */
public interface MainGraph {
   int numVertices();

   int numEdges();

   int vertexId(int pos);

   /**
    * @return position of the vertex, or -1 when the graph has no such vertex
    */
   int vertexPosition(int vertexId);

   boolean containsVertex(int vertexId);

   /**
    * @return the largest vertex id, or -1 for the empty graph
    */
   int maxVertexId();

   /**
    * Ascending neighbour positions. The returned array is shared and must not
    * be modified.
    */
   int[] neighborhoodVertices(int pos);

   int vertexDegree(int pos);

   boolean isNeighbour(int u, int v);

   /**
    * Visits every edge once as a pair of positions {@code (u, v)} with
    * {@code u < v}, in ascending order.
    */
   void forEachEdge(IntIntConsumer consumer);
}
