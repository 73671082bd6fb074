package br.ufmg.cs.systems.canon.isomorphism;

import br.ufmg.cs.systems.canon.graph.MainGraph;
import br.ufmg.cs.systems.canon.graph.VertexLabels;
import com.koloboke.collect.map.IntIntMap;
import org.apache.log4j.Logger;
import org.jgrapht.Graph;
import org.jgrapht.alg.isomorphism.VF2GraphIsomorphismInspector;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.SimpleGraph;

import javax.annotation.Nullable;
import java.util.Arrays;

/**
 * Label-aware isomorphism test backed by the VF2 matcher of JGraphT.
 */
public class Vf2IsomorphismOracle implements IsomorphismOracle {
   private static final Logger LOG = Logger.getLogger(Vf2IsomorphismOracle.class);

   @Override
   public boolean isomorphic(MainGraph a, @Nullable IntIntMap labelsA,
                             MainGraph b, @Nullable IntIntMap labelsB) {
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

      // vertices of b are numbered after those of a, sharing one label array
      int offset = a.numVertices();
      int[] labels = new int[offset + b.numVertices()];
      System.arraycopy(positionLabelsA, 0, labels, 0, offset);
      System.arraycopy(positionLabelsB, 0, labels, offset, b.numVertices());

      Graph<Integer, DefaultEdge> graphA = toJGraphT(a, 0);
      Graph<Integer, DefaultEdge> graphB = toJGraphT(b, offset);

      VF2GraphIsomorphismInspector<Integer, DefaultEdge> inspector =
              new VF2GraphIsomorphismInspector<>(graphA, graphB,
                      (u, v) -> Integer.compare(labels[u], labels[v]), null);

      boolean isomorphic = inspector.isomorphismExists();
      if (LOG.isDebugEnabled()) {
         LOG.debug("VF2 on " + a.numVertices() + " vertices: " + isomorphic);
      }
      return isomorphic;
   }

   private static Graph<Integer, DefaultEdge> toJGraphT(MainGraph graph, int offset) {
      Graph<Integer, DefaultEdge> result = new SimpleGraph<>(DefaultEdge.class);
      for (int pos = 0; pos < graph.numVertices(); ++pos) {
         result.addVertex(offset + pos);
      }
      graph.forEachEdge((u, v) -> result.addEdge(offset + u, offset + v));
      return result;
   }
}
