package br.ufmg.cs.systems.canon.io;

import br.ufmg.cs.systems.canon.graph.MainGraph;
import com.koloboke.collect.map.IntIntMap;

import javax.annotation.Nullable;

/**
 * A graph with its optional vertex labels (vertex id to label).
 */
public class LabeledGraph {
   private final MainGraph graph;
   private final IntIntMap labels;

   public LabeledGraph(MainGraph graph, @Nullable IntIntMap labels) {
      this.graph = graph;
      this.labels = labels;
   }

   public MainGraph getGraph() {
      return graph;
   }

   @Nullable
   public IntIntMap getLabels() {
      return labels;
   }

   public boolean isLabeled() {
      return labels != null;
   }

   @Override
   public String toString() {
      return "LabeledGraph{graph=" + graph + ", labels=" + labels + "}";
   }
}
