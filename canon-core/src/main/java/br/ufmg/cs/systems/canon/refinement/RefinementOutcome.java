package br.ufmg.cs.systems.canon.refinement;

/**
 * Result of a refinement that can be ordered against results of the same
 * kind: canonical forms of top-level runs, or stabilized colorings of plain
 * runs.
 */
public abstract class RefinementOutcome {

   /**
    * @return true for canonical forms, false for plain refinements
    */
   public abstract boolean isCanonical();

   /**
    * Orders this outcome against another one of the same kind. Callers check
    * the kinds first, see {@link #isCanonical()}.
    */
   public abstract int compareSameKind(RefinementOutcome other);
}
