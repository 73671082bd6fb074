package br.ufmg.cs.systems.canon.pattern;

import br.ufmg.cs.systems.canon.refinement.RefinementOutcome;
import br.ufmg.cs.systems.canon.util.InvariantViolationException;

import java.util.Comparator;

/**
 * Total order over refinement outcomes of the same kind. Results are -1, 0
 * or 1. Comparing a canonical form with a plain refinement is a programming
 * error and fails.
 */
public class CanonicalFormComparator implements Comparator<RefinementOutcome> {
   public static final CanonicalFormComparator INSTANCE = new CanonicalFormComparator();

   @Override
   public int compare(RefinementOutcome a, RefinementOutcome b) {
      return compareOutcomes(a, b);
   }

   public static int compareOutcomes(RefinementOutcome a, RefinementOutcome b) {
      if (a.isCanonical() != b.isCanonical()) {
         throw new InvariantViolationException("Cannot compare a canonical form " +
                 "with a plain refinement result");
      }
      return Integer.signum(a.compareSameKind(b));
   }

   public static boolean equals(RefinementOutcome a, RefinementOutcome b) {
      return compareOutcomes(a, b) == 0;
   }
}
