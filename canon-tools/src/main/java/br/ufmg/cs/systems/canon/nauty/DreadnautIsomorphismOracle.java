package br.ufmg.cs.systems.canon.nauty;

import br.ufmg.cs.systems.canon.graph.BasicMainGraph;
import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.graph.VertexLabels;
import br.ufmg.cs.systems.canon.isomorphism.IsomorphismOracle;
import br.ufmg.cs.systems.canon.util.collection.PrimitiveArrays;
import com.koloboke.collect.map.IntIntMap;
import com.koloboke.collect.map.hash.HashIntIntMaps;
import org.apache.log4j.Logger;

import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * Isomorphism through orbit counts. Each graph gets an apex vertex joined to
 * all its vertices; the union of both apexed graphs has as many orbits as one
 * apexed graph alone exactly when the two graphs are isomorphic.
 */
public class DreadnautIsomorphismOracle implements IsomorphismOracle {
   private static final Logger LOG = Logger.getLogger(DreadnautIsomorphismOracle.class);

   private final DreadnautRunner runner;

   public DreadnautIsomorphismOracle(DreadnautRunner runner) {
      this.runner = runner;
   }

   @Override
   public boolean isomorphic(MainGraph a, @Nullable IntIntMap labelsA,
                             MainGraph b, @Nullable IntIntMap labelsB)
           throws NautyException {
      int[] positionLabelsA = VertexLabels.fromMap(a, labelsA);
      int[] positionLabelsB = VertexLabels.fromMap(b, labelsB);

      if (a.numVertices() != b.numVertices() || a.numEdges() != b.numEdges()) {
         return false;
      }
      if (a.numVertices() == 0) {
         return true;
      }

      int[] sortedA = positionLabelsA.clone();
      int[] sortedB = positionLabelsB.clone();
      Arrays.sort(sortedA);
      Arrays.sort(sortedB);
      if (!Arrays.equals(sortedA, sortedB)) {
         return false;
      }

      // both label sets are the same, so their ranks agree and the apex takes
      // the next free rank
      positionLabelsA = PrimitiveArrays.denseRanks(PrimitiveArrays.toLongArray(positionLabelsA));
      positionLabelsB = PrimitiveArrays.denseRanks(PrimitiveArrays.toLongArray(positionLabelsB));
      int apexLabel = PrimitiveArrays.countDistinct(positionLabelsA);

      BasicMainGraph.Builder unionBuilder = BasicMainGraph.builder();
      IntIntMap unionLabels = HashIntIntMaps.newMutableMap();
      int bStart = addApexed(unionBuilder, unionLabels, a, positionLabelsA, 0, apexLabel);
      addApexed(unionBuilder, unionLabels, b, positionLabelsB, bStart, apexLabel);

      BasicMainGraph.Builder singleBuilder = BasicMainGraph.builder();
      IntIntMap singleLabels = HashIntIntMaps.newMutableMap();
      addApexed(singleBuilder, singleLabels, a, positionLabelsA, 0, apexLabel);

      int unionOrbits = runner.orbits(unionBuilder.build(), unionLabels).getNumOrbits();
      int singleOrbits = runner.orbits(singleBuilder.build(), singleLabels).getNumOrbits();

      if (LOG.isDebugEnabled()) {
         LOG.debug("Orbits of the union: " + unionOrbits + ", of the first graph: " +
                 singleOrbits);
      }
      return unionOrbits == singleOrbits;
   }

   /**
    * Adds {@code graph} with ids shifted to start at {@code start}, plus an
    * apex adjacent to all of its vertices.
    *
    * @return first id after the apex
    */
   static int addApexed(BasicMainGraph.Builder builder, IntIntMap labels,
                        MainGraph graph, int[] positionLabels, int start,
                        int apexLabel) {
      int numVertices = graph.numVertices();
      int apex = start + numVertices;
      for (int pos = 0; pos < numVertices; ++pos) {
         builder.addEdge(start + pos, apex);
         labels.put(start + pos, positionLabels[pos]);
      }
      builder.addVertex(apex);
      labels.put(apex, apexLabel);
      graph.forEachEdge((u, v) -> builder.addEdge(start + u, start + v));
      return apex + 1;
   }
}
