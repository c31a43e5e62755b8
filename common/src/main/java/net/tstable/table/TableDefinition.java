// This file is part of TSTable.
// Copyright (C) 2026 The TSTable Authors.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//   http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package net.tstable.table;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

import net.tstable.common.Const;
import net.tstable.exceptions.TableDefinitionException;
import net.tstable.utils.JSON;
import net.tstable.utils.YAML;

/**
 * The static declaration of a logical table: its name, the ordered lines
 * (columns) and the timeframes each line is kept in.
 * <p>
 * Exactly one timeframe without a bucket and without the no-rules flag is the
 * base timeframe. Compacted timeframes (those with a bucket) are fed from the
 * base, either directly or through the chain of smaller buckets depending on
 * the {@link RuleSource}. Timeframes flagged no-rules are independent tiers
 * written directly. When a table has no base, the first no-rules timeframe is
 * the default write target.
 * <p>
 * Names are lower cased. Instances are immutable; {@link #withLine(String)}
 * and {@link #withoutLine(String)} return modified copies.
 *
 * @since 1.0
 */
@JsonInclude(Include.NON_NULL)
@JsonDeserialize(builder = TableDefinition.Builder.class)
public class TableDefinition {
  private static final Logger LOG = LoggerFactory.getLogger(TableDefinition.class);

  /** The table name, first component of every key. */
  private final String name;

  /** The ordered line names. */
  private final List<String> lines;

  /** The timeframes in declaration order. */
  private final Map<String, TimeframeSpec> timeframes;

  /** The rule aggregator selection. */
  private final AggregatorSelector selector;

  /** Where compacted timeframes read from. */
  private final RuleSource rule_source;

  /** The base timeframe or null if the table only has no-rules tiers. */
  private final String base_timeframe;

  /** The timeframe written when the caller doesn't name one. */
  private final String default_write_timeframe;

  /** Compacted timeframes sorted by ascending bucket. */
  private final List<String> ruled_timeframes;

  /**
   * Protected builder ctor.
   * @param builder The non-null builder.
   * @throws TableDefinitionException if the definition was malformed.
   */
  protected TableDefinition(final Builder builder) {
    name = checkName("Table name", builder.name);

    if (builder.lines == null || builder.lines.isEmpty()) {
      throw new TableDefinitionException("Table '" + name
          + "' must declare at least one line.");
    }
    final Set<String> dedupe = Sets.newHashSetWithExpectedSize(builder.lines.size());
    final ImmutableList.Builder<String> line_builder = ImmutableList.builder();
    for (final String line : builder.lines) {
      final String normalized = checkName("Line name", line);
      if (!dedupe.add(normalized)) {
        throw new TableDefinitionException("Duplicate line '" + normalized
            + "' in table '" + name + "'.");
      }
      line_builder.add(normalized);
    }
    lines = line_builder.build();

    if (builder.timeframes == null || builder.timeframes.isEmpty()) {
      throw new TableDefinitionException("Table '" + name
          + "' must declare at least one timeframe.");
    }
    final Map<String, TimeframeSpec> tfs = new LinkedHashMap<String, TimeframeSpec>();
    String base = null;
    String first_no_rules = null;
    final Map<Long, String> buckets = Maps.newHashMap();
    for (final Entry<String, TimeframeSpec> entry : builder.timeframes.entrySet()) {
      final String tf = checkName("Timeframe name", entry.getKey());
      final TimeframeSpec spec = entry.getValue();
      if (spec == null) {
        throw new TableDefinitionException("Timeframe '" + tf
            + "' has no spec.");
      }
      if (tfs.put(tf, spec) != null) {
        throw new TableDefinitionException("Duplicate timeframe '" + tf
            + "' in table '" + name + "'.");
      }
      if (spec.isRuled()) {
        final String other = buckets.put(spec.getBucket(), tf);
        if (other != null) {
          throw new TableDefinitionException("Timeframes '" + other + "' and '"
              + tf + "' share the bucket " + spec.getBucket()
              + ". Buckets must be strictly increasing along the rule chain.");
        }
      } else if (spec.isNoRules()) {
        if (first_no_rules == null) {
          first_no_rules = tf;
        }
      } else {
        if (base != null) {
          throw new TableDefinitionException("Timeframes '" + base + "' and '"
              + tf + "' both lack a bucket. Only one base timeframe is "
              + "allowed, flag the others as noRules.");
        }
        base = tf;
      }
    }
    if (!buckets.isEmpty() && base == null) {
      throw new TableDefinitionException("Table '" + name + "' has compacted "
          + "timeframes " + buckets.values() + " but no base timeframe.");
    }
    timeframes = ImmutableMap.copyOf(tfs);
    base_timeframe = base;
    default_write_timeframe = base != null ? base : first_no_rules;

    final List<String> ruled = Lists.newArrayList(buckets.values());
    Collections.sort(ruled, new Comparator<String>() {
      @Override
      public int compare(final String a, final String b) {
        return Long.compare(timeframes.get(a).getBucket(),
            timeframes.get(b).getBucket());
      }
    });
    ruled_timeframes = ImmutableList.copyOf(ruled);

    if (builder.selector != null) {
      selector = builder.selector;
    } else if (builder.aggregators != null) {
      for (final String line : builder.aggregators.keySet()) {
        if (!lines.contains(line.toLowerCase())) {
          throw new TableDefinitionException("Aggregator mapped for unknown "
              + "line '" + line + "' in table '" + name + "'.");
        }
      }
      selector = new LineAggregatorSelector(builder.aggregators);
    } else {
      selector = AggregatorSelector.NONE;
    }
    rule_source = builder.ruleSource == null ? RuleSource.CHAIN :
      builder.ruleSource;

    if (LOG.isDebugEnabled()) {
      LOG.debug("Loaded table definition: " + this);
    }
  }

  /** @return The table name. */
  @JsonProperty("name")
  public String getName() {
    return name;
  }

  /** @return The ordered, immutable line names. */
  @JsonProperty("lines")
  public List<String> getLines() {
    return lines;
  }

  /** @return The timeframes in declaration order. */
  @JsonProperty("timeframes")
  public Map<String, TimeframeSpec> getTimeframes() {
    return timeframes;
  }

  /** @return The timeframe names in declaration order. */
  @JsonIgnore
  public List<String> getTimeframeNames() {
    return ImmutableList.copyOf(timeframes.keySet());
  }

  /** @return The rule source topology. */
  @JsonProperty("ruleSource")
  public RuleSource getRuleSource() {
    return rule_source;
  }

  /** @return The line to aggregator map when the selector is a
   * {@link LineAggregatorSelector}, null otherwise. */
  @JsonProperty("aggregators")
  public Map<String, String> getAggregators() {
    if (selector instanceof LineAggregatorSelector) {
      return ((LineAggregatorSelector) selector).getAggregators();
    }
    return null;
  }

  /** @return The aggregator selection. */
  @JsonIgnore
  public AggregatorSelector getAggregatorSelector() {
    return selector;
  }

  /** @return The base timeframe or null if the table has none. */
  @JsonIgnore
  public String getBaseTimeframe() {
    return base_timeframe;
  }

  /** @return The timeframe written when none is given. */
  @JsonIgnore
  public String getDefaultWriteTimeframe() {
    return default_write_timeframe;
  }

  /** @return The compacted timeframes sorted by ascending bucket. */
  @JsonIgnore
  public List<String> getRuledTimeframes() {
    return ruled_timeframes;
  }

  /**
   * @param line A line name, case insensitive.
   * @return True if the line is declared.
   */
  public boolean hasLine(final String line) {
    return line != null && lines.contains(line.toLowerCase());
  }

  /**
   * @param line A line name, case insensitive.
   * @return The zero based position of the line.
   * @throws TableDefinitionException if the line is not declared.
   */
  public int lineIndex(final String line) {
    final int idx = line == null ? -1 : lines.indexOf(line.toLowerCase());
    if (idx < 0) {
      throw new TableDefinitionException("Unknown line '" + line
          + "' for table '" + name + "'. Declared lines: " + lines);
    }
    return idx;
  }

  /**
   * @param timeframe A timeframe name, case insensitive.
   * @return The timeframe settings.
   * @throws TableDefinitionException if the timeframe is not declared.
   */
  public TimeframeSpec getTimeframe(final String timeframe) {
    final TimeframeSpec spec = timeframe == null ? null :
      timeframes.get(timeframe.toLowerCase());
    if (spec == null) {
      throw new TableDefinitionException("Unknown timeframe '" + timeframe
          + "' for table '" + name + "'. Declared timeframes: "
          + timeframes.keySet());
    }
    return spec;
  }

  /**
   * Resolves the timeframe a compacted timeframe's rule reads from.
   * @param timeframe A compacted timeframe.
   * @return The source timeframe.
   * @throws TableDefinitionException if the timeframe is not compacted.
   */
  public String getRuleSourceTimeframe(final String timeframe) {
    final String tf = timeframe.toLowerCase();
    final int idx = ruled_timeframes.indexOf(tf);
    if (idx < 0) {
      throw new TableDefinitionException("Timeframe '" + timeframe
          + "' is not a compaction target.");
    }
    if (rule_source == RuleSource.BASE || idx == 0) {
      return base_timeframe;
    }
    return ruled_timeframes.get(idx - 1);
  }

  /**
   * @param line A new line name.
   * @return A copy of this definition with the line appended.
   * @throws TableDefinitionException if the line exists or is invalid.
   */
  public TableDefinition withLine(final String line) {
    final List<String> new_lines = Lists.newArrayList(lines);
    new_lines.add(line);
    return toBuilder().setLines(new_lines).build();
  }

  /**
   * @param line An existing line name.
   * @return A copy of this definition without the line.
   * @throws TableDefinitionException if the line is unknown or the last one.
   */
  public TableDefinition withoutLine(final String line) {
    final List<String> new_lines = Lists.newArrayList(lines);
    new_lines.remove(lineIndex(line));
    return toBuilder().setLines(new_lines).build();
  }

  @Override
  public String toString() {
    return JSON.serializeToString(this);
  }

  /** @return A builder seeded with this definition. */
  public Builder toBuilder() {
    return newBuilder()
        .setName(name)
        .setLines(Lists.newArrayList(lines))
        .setTimeframes(new LinkedHashMap<String, TimeframeSpec>(timeframes))
        .setAggregatorSelector(selector)
        .setRuleSource(rule_source);
  }

  /**
   * Loads a definition from a YAML file, or JSON if the name ends in ".json".
   * @param path The non-null path.
   * @return The definition.
   * @throws TableDefinitionException if the file could not be read, parsed
   * or validated.
   */
  public static TableDefinition load(final Path path) {
    if (path == null) {
      throw new IllegalArgumentException("Path cannot be null.");
    }
    try (final InputStream stream = Files.newInputStream(path)) {
      final TableDefinition table = path.toString().endsWith(".json") ?
          JSON.parseToObject(stream, TableDefinition.class) :
          YAML.parseToObject(stream, TableDefinition.class);
      LOG.info("Loaded table '" + table.getName() + "' from " + path);
      return table;
    } catch (IOException e) {
      throw new TableDefinitionException("Failed to open table file: " + path, e);
    } catch (TableDefinitionException e) {
      throw e;
    } catch (IllegalArgumentException e) {
      throw new TableDefinitionException("Failed to parse table file: "
          + path + ": " + e.getMessage(), e);
    }
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  private static String checkName(final String what, final String value) {
    if (Strings.isNullOrEmpty(value) || value.trim().isEmpty()) {
      throw new TableDefinitionException(what + " cannot be null or empty.");
    }
    if (value.indexOf(Const.KEY_SEPARATOR) >= 0) {
      throw new TableDefinitionException(what + " '" + value
          + "' cannot contain '" + Const.KEY_SEPARATOR + "'.");
    }
    return value.trim().toLowerCase();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static class Builder {
    @JsonProperty
    private String name;
    @JsonProperty
    private List<String> lines;
    @JsonProperty
    private LinkedHashMap<String, TimeframeSpec> timeframes;
    @JsonProperty
    private Map<String, String> aggregators;
    @JsonProperty
    private RuleSource ruleSource;
    @JsonIgnore
    private AggregatorSelector selector;

    public Builder setName(final String name) {
      this.name = name;
      return this;
    }

    public Builder setLines(final List<String> lines) {
      this.lines = lines;
      return this;
    }

    @JsonIgnore
    public Builder addLine(final String line) {
      if (lines == null) {
        lines = Lists.newArrayList();
      }
      lines.add(line);
      return this;
    }

    public Builder setTimeframes(final Map<String, TimeframeSpec> timeframes) {
      this.timeframes = timeframes == null ? null :
        new LinkedHashMap<String, TimeframeSpec>(timeframes);
      return this;
    }

    @JsonIgnore
    public Builder addTimeframe(final String name, final TimeframeSpec spec) {
      if (timeframes == null) {
        timeframes = new LinkedHashMap<String, TimeframeSpec>();
      }
      timeframes.put(name, spec);
      return this;
    }

    @JsonIgnore
    public Builder addTimeframe(final String name,
                                final TimeframeSpec.Builder spec) {
      return addTimeframe(name, spec.build());
    }

    /**
     * Sets a line to aggregator mapping used when no selector is given.
     * @param aggregators A map of line names to aggregator names.
     * @return The builder.
     */
    public Builder setAggregators(final Map<String, String> aggregators) {
      this.aggregators = aggregators;
      return this;
    }

    /**
     * @param selector A custom selector that takes precedence over the
     * aggregator map.
     * @return The builder.
     */
    @JsonIgnore
    public Builder setAggregatorSelector(final AggregatorSelector selector) {
      this.selector = selector;
      return this;
    }

    public Builder setRuleSource(final RuleSource rule_source) {
      this.ruleSource = rule_source;
      return this;
    }

    public TableDefinition build() {
      return new TableDefinition(this);
    }
  }
}
