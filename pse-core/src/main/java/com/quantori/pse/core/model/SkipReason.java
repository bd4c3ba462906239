package com.quantori.pse.core.model;

/** Why an identifier produced no record. None of these is an error. */
public enum SkipReason {
  /** The vendor answered with its "no such identifier" page. */
  NOT_FOUND,
  /** The page has no name, i.e. it describes a pooled resource rather than a single plasmid. */
  NAME_UNRESOLVED,
  /** No profile is registered for the requested vendor. */
  UNSUPPORTED_VENDOR
}
