package br.ufmg.cs.systems.canon.graph;

import java.util.Arrays;

public class BreadthFirstDistances {
   public static final int UNREACHABLE = -1;

   /**
    * Single-source shortest path lengths (in edges) from {@code source},
    * indexed by position. Vertices in other components get
    * {@link #UNREACHABLE}.
    */
   public static int[] from(MainGraph graph, int source) {
      int numVertices = graph.numVertices();
      int[] distances = new int[numVertices];
      Arrays.fill(distances, UNREACHABLE);

      int[] queue = new int[numVertices];
      int head = 0, tail = 0;
      distances[source] = 0;
      queue[tail++] = source;

      while (head < tail) {
         int u = queue[head++];
         for (int v : graph.neighborhoodVertices(u)) {
            if (distances[v] == UNREACHABLE) {
               distances[v] = distances[u] + 1;
               queue[tail++] = v;
            }
         }
      }

      return distances;
   }

   /**
    * Same as {@link #from(MainGraph, int)} but unreachable vertices are placed
    * one step beyond the farthest reachable one.
    */
   public static int[] fromClosed(MainGraph graph, int source) {
      int[] distances = from(graph, source);
      int maxDistance = 0;
      for (int d : distances) {
         maxDistance = Math.max(maxDistance, d);
      }
      for (int i = 0; i < distances.length; ++i) {
         if (distances[i] == UNREACHABLE) {
            distances[i] = maxDistance + 1;
         }
      }
      return distances;
   }
}
