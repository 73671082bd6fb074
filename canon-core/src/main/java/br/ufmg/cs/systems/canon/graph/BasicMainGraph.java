package br.ufmg.cs.systems.canon.graph;

import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import com.koloboke.collect.map.hash.HashIntObjMap;
import com.koloboke.collect.map.hash.HashIntObjMaps;
import com.koloboke.collect.set.hash.HashIntSet;
import com.koloboke.collect.set.hash.HashIntSets;
import com.koloboke.function.IntIntConsumer;

import java.util.Arrays;

public class BasicMainGraph implements MainGraph {
   public static final BasicMainGraph EMPTY = new Builder().build();

   private final int[] vertexIds;
   // K = vertex id, V = vertex position
   private final IntIntMap vertexPositions;
   private final int[][] vertexNeighbourhoods;
   private final int numEdges;

   private BasicMainGraph(int[] vertexIds, int[][] vertexNeighbourhoods,
                          int numEdges) {
      this.vertexIds = vertexIds;
      this.vertexNeighbourhoods = vertexNeighbourhoods;
      this.numEdges = numEdges;
      this.vertexPositions = HashIntIntMaps.getDefaultFactory()
              .withDefaultValue(-1).newMutableMap(vertexIds.length);
      for (int pos = 0; pos < vertexIds.length; ++pos) {
         vertexPositions.put(vertexIds[pos], pos);
      }
   }

   public static Builder builder() {
      return new Builder();
   }

   @Override
   public int numVertices() {
      return vertexIds.length;
   }

   @Override
   public int numEdges() {
      return numEdges;
   }

   @Override
   public int vertexId(int pos) {
      return vertexIds[pos];
   }

   @Override
   public int vertexPosition(int vertexId) {
      return vertexPositions.get(vertexId);
   }

   @Override
   public boolean containsVertex(int vertexId) {
      return vertexPositions.containsKey(vertexId);
   }

   @Override
   public int maxVertexId() {
      return vertexIds.length == 0 ? -1 : vertexIds[vertexIds.length - 1];
   }

   @Override
   public int[] neighborhoodVertices(int pos) {
      return vertexNeighbourhoods[pos];
   }

   @Override
   public int vertexDegree(int pos) {
      return vertexNeighbourhoods[pos].length;
   }

   @Override
   public boolean isNeighbour(int u, int v) {
      return Arrays.binarySearch(vertexNeighbourhoods[u], v) >= 0;
   }

   @Override
   public void forEachEdge(IntIntConsumer consumer) {
      for (int u = 0; u < vertexNeighbourhoods.length; ++u) {
         for (int v : vertexNeighbourhoods[u]) {
            if (u < v) {
               consumer.accept(u, v);
            }
         }
      }
   }

   @Override
   public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;

      BasicMainGraph that = (BasicMainGraph) o;

      if (numEdges != that.numEdges) return false;
      if (!Arrays.equals(vertexIds, that.vertexIds)) return false;
      return Arrays.deepEquals(vertexNeighbourhoods, that.vertexNeighbourhoods);
   }

   @Override
   public int hashCode() {
      int result = Arrays.hashCode(vertexIds);
      result = 31 * result + Arrays.deepHashCode(vertexNeighbourhoods);
      return result;
   }

   @Override
   public String toString() {
      StringBuilder sb = new StringBuilder();
      sb.append("BasicMainGraph{numVertices=").append(numVertices());
      sb.append(",edges=[");
      forEachEdge(new IntIntConsumer() {
         boolean first = true;

         @Override
         public void accept(int u, int v) {
            if (!first) sb.append(",");
            sb.append(vertexIds[u]).append("-").append(vertexIds[v]);
            first = false;
         }
      });
      sb.append("]}");
      return sb.toString();
   }

   /**
    * Collects vertices and edges by id. Duplicate edges collapse into one;
    * self-loops and negative ids are rejected.
    */
   public static class Builder {
      // K = vertex id, V = neighbour ids
      private final HashIntObjMap<HashIntSet> adjacency =
              HashIntObjMaps.newMutableMap();

      public Builder addVertex(int vertexId) {
         if (vertexId < 0) {
            throw new IllegalArgumentException("Negative vertex id " + vertexId);
         }
         if (!adjacency.containsKey(vertexId)) {
            adjacency.put(vertexId, HashIntSets.newMutableSet());
         }
         return this;
      }

      public Builder addEdge(int u, int v) {
         if (u == v) {
            throw new IllegalArgumentException("Self-loop on vertex " + u);
         }
         addVertex(u);
         addVertex(v);
         adjacency.get(u).add(v);
         adjacency.get(v).add(u);
         return this;
      }

      public int numVertices() {
         return adjacency.size();
      }

      public BasicMainGraph build() {
         int[] vertexIds = adjacency.keySet().toIntArray();
         Arrays.sort(vertexIds);

         IntIntMap positions = HashIntIntMaps.newMutableMap(vertexIds.length);
         for (int pos = 0; pos < vertexIds.length; ++pos) {
            positions.put(vertexIds[pos], pos);
         }

         int[][] neighbourhoods = new int[vertexIds.length][];
         int degreeSum = 0;
         for (int pos = 0; pos < vertexIds.length; ++pos) {
            int[] neighbours = adjacency.get(vertexIds[pos]).toIntArray();
            for (int i = 0; i < neighbours.length; ++i) {
               neighbours[i] = positions.get(neighbours[i]);
            }
            Arrays.sort(neighbours);
            neighbourhoods[pos] = neighbours;
            degreeSum += neighbours.length;
         }

         return new BasicMainGraph(vertexIds, neighbourhoods, degreeSum / 2);
      }
   }
}
