package br.ufmg.cs.systems.canon.isomorphism;

import br.ufmg.cs.systems.canon.graph.MainGraph;
import com.koloboke.collect.map.IntIntMap;

import javax.annotation.Nullable;
import java.io.IOException;

/**
 * Decides labeled graph isomorphism independently of canonical forms, to
 * check them against. Null labels mean all vertices share one label.
 */
public interface IsomorphismOracle {
   boolean isomorphic(MainGraph a, @Nullable IntIntMap labelsA,
                      MainGraph b, @Nullable IntIntMap labelsB) throws IOException;
}
