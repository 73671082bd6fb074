package br.ufmg.cs.systems.canon.isomorphism;

import br.ufmg.cs.systems.canon.graph.BasicMainGraph;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.pattern.CanonicalForm;
import br.ufmg.cs.systems.canon.pattern.Canonizer;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import org.junit.Test;

import java.io.IOException;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class Vf2IsomorphismOracleTest {
   private final IsomorphismOracle oracle = new Vf2IsomorphismOracle();

   private static BasicMainGraph graph(int numVertices, int[][] edges) {
      BasicMainGraph.Builder builder = BasicMainGraph.builder();
      for (int v = 0; v < numVertices; ++v) builder.addVertex(v);
      for (int[] e : edges) builder.addEdge(e[0], e[1]);
      return builder.build();
   }

   private static BasicMainGraph random(int numVertices, Random random) {
      BasicMainGraph.Builder builder = BasicMainGraph.builder();
      for (int v = 0; v < numVertices; ++v) {
         builder.addVertex(v);
         for (int u = 0; u < v; ++u) {
            if (random.nextBoolean()) builder.addEdge(u, v);
         }
      }
      return builder.build();
   }

   private static IntIntMap labels(int... labels) {
      IntIntMap map = HashIntIntMaps.newMutableMap();
      for (int v = 0; v < labels.length; ++v) map.put(v, labels[v]);
      return map;
   }

   @Test
   public void testRelabeledPath() throws IOException {
      MainGraph path = graph(3, new int[][]{{0, 1}, {1, 2}});
      MainGraph relabeled = graph(3, new int[][]{{0, 2}, {2, 1}});

      assertTrue(oracle.isomorphic(path, null, relabeled, null));
   }

   @Test
   public void testLabelsMatter() throws IOException {
      MainGraph path = graph(3, new int[][]{{0, 1}, {1, 2}});

      assertTrue(oracle.isomorphic(path, labels(1, 0, 0), path, labels(0, 0, 1)));
      assertFalse(oracle.isomorphic(path, labels(1, 0, 0), path, labels(0, 1, 0)));
   }

   @Test
   public void testStarAndPath() throws IOException {
      MainGraph star = graph(4, new int[][]{{0, 1}, {0, 2}, {0, 3}});
      MainGraph path = graph(4, new int[][]{{0, 1}, {1, 2}, {2, 3}});

      assertFalse(oracle.isomorphic(star, null, path, null));
   }

   @Test
   public void testEmptyGraphs() throws IOException {
      assertTrue(oracle.isomorphic(BasicMainGraph.EMPTY, null,
              BasicMainGraph.EMPTY, null));
      assertFalse(oracle.isomorphic(BasicMainGraph.EMPTY, null,
              graph(1, new int[0][]), null));
   }

   @Test
   public void testCanonicalFormsAgreeWithVf2() throws IOException {
      Canonizer canonizer = new Canonizer();
      Random random = new Random(2024);
      int numIsomorphic = 0;

      for (int k = 0; k < 60; ++k) {
         int numVertices = 2 + random.nextInt(4);
         MainGraph a = random(numVertices, random);
         MainGraph b = random(numVertices, random);

         CanonicalForm formA = canonizer.canonicalize(a);
         CanonicalForm formB = canonizer.canonicalize(b);
         boolean isomorphic = oracle.isomorphic(a, null, b, null);

         assertEquals(a + " vs " + b, isomorphic, canonizer.equals(formA, formB));
         if (isomorphic) ++numIsomorphic;
      }

      assertTrue(numIsomorphic > 0);
   }
}
