package com.quantori.pse.api.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import lombok.EqualsAndHashCode;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

/**
 * A plasmid record assembled from the vendor pages of one identifier.
 *
 * <p>Instances are immutable. An attribute that could not be resolved is simply missing from
 * {@link #getAttributes()} and reported as {@link Optional#empty()}, it is never stored as an empty
 * string. Sinks decide how an absent value is rendered.
 */
@EqualsAndHashCode
@ToString(exclude = "sequence")
public final class Plasmid {
  private final int id;
  private final String name;
  private final String vendor;
  private final String vendorUrl;
  private final Integer sizeBasePairs;
  private final Map<PlasmidAttribute, String> attributes;
  private final String sequence;

  private Plasmid(Builder builder) {
    if (StringUtils.isBlank(builder.name)) {
      throw new IllegalArgumentException("Plasmid " + builder.id + " must have a name");
    }
    this.id = builder.id;
    this.name = builder.name;
    this.vendor = builder.vendor;
    this.vendorUrl = builder.vendorUrl;
    this.sizeBasePairs = builder.sizeBasePairs;
    this.attributes = Collections.unmodifiableMap(new EnumMap<>(builder.attributes));
    this.sequence = builder.sequence;
  }

  public static Builder builder(int id, String name) {
    return new Builder(id, name);
  }

  public int getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getVendor() {
    return vendor;
  }

  public String getVendorUrl() {
    return vendorUrl;
  }

  public Optional<Integer> getSizeBasePairs() {
    return Optional.ofNullable(sizeBasePairs);
  }

  /** Resolved attributes only. */
  public Map<PlasmidAttribute, String> getAttributes() {
    return attributes;
  }

  public Optional<String> getAttribute(PlasmidAttribute attribute) {
    return Optional.ofNullable(attributes.get(attribute));
  }

  public Optional<String> getSequence() {
    return Optional.ofNullable(sequence);
  }

  public static final class Builder {
    private final int id;
    private final String name;
    private String vendor;
    private String vendorUrl;
    private Integer sizeBasePairs;
    private final Map<PlasmidAttribute, String> attributes = new EnumMap<>(PlasmidAttribute.class);
    private String sequence;

    private Builder(int id, String name) {
      this.id = id;
      this.name = name;
    }

    public Builder vendor(String vendor) {
      this.vendor = vendor;
      return this;
    }

    public Builder vendorUrl(String vendorUrl) {
      this.vendorUrl = vendorUrl;
      return this;
    }

    public Builder sizeBasePairs(Integer sizeBasePairs) {
      this.sizeBasePairs = sizeBasePairs;
      return this;
    }

    /** Sets an attribute; a {@code null} value leaves it absent. */
    public Builder attribute(PlasmidAttribute attribute, String value) {
      Objects.requireNonNull(attribute);
      if (value == null) {
        attributes.remove(attribute);
      } else {
        attributes.put(attribute, value);
      }
      return this;
    }

    public Builder attributes(Map<PlasmidAttribute, String> values) {
      values.forEach(this::attribute);
      return this;
    }

    public Builder sequence(String sequence) {
      this.sequence = sequence;
      return this;
    }

    public Plasmid build() {
      return new Plasmid(this);
    }
  }
}
