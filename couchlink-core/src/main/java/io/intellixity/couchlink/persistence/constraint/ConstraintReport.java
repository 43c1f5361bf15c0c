package io.intellixity.couchlink.persistence.constraint;

import java.util.ArrayList;
import java.util.List;

/** All constraint verdicts for one write, in declaration order. */
public record ConstraintReport(List<ConstraintResult> results) {
  public static final ConstraintReport EMPTY = new ConstraintReport(List.of());

  public ConstraintReport {
    results = (results == null) ? List.of() : List.copyOf(results);
  }

  public List<ConstraintViolation> violations() {
    List<ConstraintViolation> out = new ArrayList<>();
    for (ConstraintResult r : results) {
      if (r instanceof ConstraintResult.Invalid inv) out.add(inv.violation());
    }
    return out;
  }

  public List<String> errors() {
    List<String> out = new ArrayList<>();
    for (ConstraintResult r : results) {
      if (r instanceof ConstraintResult.Error e) out.add(e.constraint() + ": " + e.reason());
    }
    return out;
  }

  public List<ConstraintResult.Pending> pending() {
    List<ConstraintResult.Pending> out = new ArrayList<>();
    for (ConstraintResult r : results) {
      if (r instanceof ConstraintResult.Pending p) out.add(p);
    }
    return out;
  }

  /** True when every result is {@code ok} or {@code ok_pending}. */
  public boolean accepted() {
    for (ConstraintResult r : results) {
      if (r instanceof ConstraintResult.Invalid || r instanceof ConstraintResult.Error) return false;
    }
    return true;
  }

  /** Accepted with no marker left to reserve. */
  public boolean settled() {
    for (ConstraintResult r : results) {
      if (!(r instanceof ConstraintResult.Ok)) return false;
    }
    return true;
  }
}
