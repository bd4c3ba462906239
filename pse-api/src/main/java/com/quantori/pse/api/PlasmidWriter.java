package com.quantori.pse.api;

import com.quantori.pse.api.model.Plasmid;

/**
 * A writer to persist assembled plasmids to a sink (a flat file, a JSON document, a table).
 *
 * <p>Implementations render absent attributes the way their storage expects and report any
 * rejection with a {@link SinkException}. A record passed to {@link #write(Plasmid)} is complete,
 * writers never receive partially extracted plasmids.
 */
public interface PlasmidWriter extends AutoCloseable {

  /**
   * Write a single plasmid.
   *
   * @param plasmid a plasmid to store
   * @throws SinkException if the sink rejects the record
   */
  void write(Plasmid plasmid);

  /**
   * Flush buffered records to the sink.
   */
  default void flush() {
  }

  /**
   * Close the writer and release the underlying resources.
   */
  @Override
  void close();
}
