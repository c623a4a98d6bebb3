// This file is part of AFExtract.
// Copyright (C) 2026  The AFExtract Authors.
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
package net.afextract.extract;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;
import com.google.common.base.Strings;

import net.afextract.data.BoundaryType;
import net.afextract.data.CalculationBasis;
import net.afextract.data.ExpressionSampleType;
import net.afextract.data.PagingConfig;
import net.afextract.data.SummaryType;
import net.afextract.data.TagSet;
import net.afextract.data.TimestampCalculation;

/**
 * The parameters of one extraction. Built with {@link #newBuilder()} or
 * deserialized from JSON, e.g.
 * <pre>
 * {"operation":"SUMMARY_EXTRACT","tags":["FIC101.PV"],
 *  "summaryTypes":["AVERAGE","MAXIMUM"]}
 * </pre>
 * The builder validates that the fields the operation needs are present.
 *
 * @since 1.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonDeserialize(builder = ExtractRequest.Builder.class)
public class ExtractRequest {
  private final Operation operation;
  private final TagSpec tag_spec;
  private final String interval;
  private final String filter_expression;
  private final Set<SummaryType> summary_types;
  private final CalculationBasis calculation_basis;
  private final TimestampCalculation timestamp_calculation;
  private final ExpressionSampleType sample_type;
  private final String filter_interval;
  private final String expression;
  private final String expression_column;
  private final BoundaryType boundary_type;
  private final int intervals;
  private final PagingConfig paging;

  /**
   * Protected ctor.
   * @param builder The non-null builder.
   */
  protected ExtractRequest(final Builder builder) {
    operation = builder.operation;
    interval = Strings.emptyToNull(builder.interval);
    filter_expression = Strings.emptyToNull(builder.filterExpression);
    calculation_basis = builder.calculationBasis == null ?
        CalculationBasis.TIME_WEIGHTED : builder.calculationBasis;
    timestamp_calculation = builder.timestampCalculation == null ?
        TimestampCalculation.AUTO : builder.timestampCalculation;
    sample_type = builder.sampleType == null ?
        ExpressionSampleType.EXPRESSION_RECORDED_VALUES : builder.sampleType;
    filter_interval = Strings.emptyToNull(builder.filterInterval);
    expression = Strings.emptyToNull(builder.expression);
    expression_column = Strings.emptyToNull(builder.expressionColumn);
    boundary_type = builder.boundaryType == null ?
        BoundaryType.INSIDE : builder.boundaryType;
    intervals = builder.intervals;

    final Set<SummaryType> types = EnumSet.noneOf(SummaryType.class);
    if (builder.summaryTypes != null) {
      types.addAll(builder.summaryTypes);
    }
    if (builder.summaryMask != 0) {
      types.addAll(SummaryType.fromMask(builder.summaryMask));
    }
    summary_types = Collections.unmodifiableSet(types);

    int specs = 0;
    TagSpec spec = null;
    if (builder.tagSet != null) {
      spec = TagSpec.of(builder.tagSet);
      specs++;
    }
    if (builder.tags != null && !builder.tags.isEmpty()) {
      spec = TagSpec.identifiers(builder.tags);
      specs++;
    }
    if (!Strings.isNullOrEmpty(builder.tagColumn)) {
      spec = TagSpec.column(builder.tagColumn);
      specs++;
    }
    if (specs > 1) {
      throw new IllegalArgumentException(
          "Only one of tags, tag set or tag column may be given.");
    }
    tag_spec = spec;

    if (builder.pagingType != null || builder.pagingSize > 0) {
      paging = new PagingConfig(
          builder.pagingType == null ?
              PagingConfig.PageType.EVENT_COUNT : builder.pagingType,
          builder.pagingSize > 0 ? builder.pagingSize : 1000);
    } else {
      paging = null;
    }
    validate();
  }

  /**
   * Checks that the operation has what it needs.
   * @throws IllegalArgumentException if something was missing.
   */
  private void validate() {
    if (operation == null) {
      throw new IllegalArgumentException("Operation cannot be null.");
    }
    if (operation != Operation.CALC_SUMMARY_EXTRACT && tag_spec == null) {
      throw new IllegalArgumentException("Tags are required for " + operation);
    }
    switch (operation) {
    case INTERPOLATED_EXTRACT:
    case CONTINUOUS_INTERPOLATED_EXTRACT:
      requireInterval();
      break;
    case SUMMARY_EXTRACT:
      requireSummaryTypes();
      break;
    case FILTERED_SUMMARY_EXTRACT:
      requireInterval();
      requireSummaryTypes();
      if (filter_expression == null) {
        throw new IllegalArgumentException(
            "A filter expression is required for " + operation);
      }
      break;
    case CALC_SUMMARY_EXTRACT:
      requireSummaryTypes();
      if ((expression == null) == (expression_column == null)) {
        throw new IllegalArgumentException(
            "Exactly one of expression or expression column is required for "
            + operation);
      }
      break;
    case PLOT_EXTRACT:
      if (intervals < 1) {
        throw new IllegalArgumentException(
            "Intervals must be at least 1 for " + operation);
      }
      break;
    default:
      break;
    }
  }

  private void requireInterval() {
    if (interval == null) {
      throw new IllegalArgumentException("An interval is required for "
          + operation);
    }
  }

  private void requireSummaryTypes() {
    if (summary_types.isEmpty()) {
      throw new IllegalArgumentException(
          "At least one summary type is required for " + operation);
    }
  }

  /** @return The operation. */
  public Operation operation() {
    return operation;
  }

  /** @return The tags to extract. Null for expression summaries. */
  public TagSpec tagSpec() {
    return tag_spec;
  }

  /** @return The sampling or summary interval. May be null. */
  public String interval() {
    return interval;
  }

  /** @return The filter expression. May be null. */
  public String filterExpression() {
    return filter_expression;
  }

  /** @return The summaries to compute, possibly empty. */
  public Set<SummaryType> summaryTypes() {
    return summary_types;
  }

  /** @return The calculation basis. */
  public CalculationBasis calculationBasis() {
    return calculation_basis;
  }

  /** @return Which timestamp to report for summaries. */
  public TimestampCalculation timestampCalculation() {
    return timestamp_calculation;
  }

  /** @return How expressions are sampled. */
  public ExpressionSampleType sampleType() {
    return sample_type;
  }

  /** @return The expression sampling interval. May be null. */
  public String filterInterval() {
    return filter_interval;
  }

  /** @return The literal expression. May be null. */
  public String expression() {
    return expression;
  }

  /** @return The column holding per row expressions. May be null. */
  public String expressionColumn() {
    return expression_column;
  }

  /** @return The boundary for recorded values. */
  public BoundaryType boundaryType() {
    return boundary_type;
  }

  /** @return The number of plot intervals. */
  public int intervals() {
    return intervals;
  }

  /** @return The paging hint, null to use the configured default. */
  public PagingConfig paging() {
    return paging;
  }

  @Override
  public String toString() {
    return new StringBuilder()
        .append("{operation=")
        .append(operation)
        .append(", tags=")
        .append(tag_spec)
        .append(", interval=")
        .append(interval)
        .append(", filterExpression=")
        .append(filter_expression)
        .append(", summaryTypes=")
        .append(summary_types)
        .append(", expression=")
        .append(expression != null ? expression : expression_column)
        .append("}")
        .toString();
  }

  /** @return A new builder. */
  public static Builder newBuilder() {
    return new Builder();
  }

  @JsonIgnoreProperties(ignoreUnknown = true)
  @JsonPOJOBuilder(buildMethodName = "build", withPrefix = "")
  public static final class Builder {
    @JsonProperty
    private Operation operation;
    @JsonProperty
    private List<String> tags;
    @JsonProperty
    private String tagColumn;
    @JsonProperty
    private String interval;
    @JsonProperty
    private String filterExpression;
    @JsonProperty
    private List<SummaryType> summaryTypes;
    @JsonProperty
    private int summaryMask;
    @JsonProperty
    private CalculationBasis calculationBasis;
    @JsonProperty
    private TimestampCalculation timestampCalculation;
    @JsonProperty
    private ExpressionSampleType sampleType;
    @JsonProperty
    private String filterInterval;
    @JsonProperty
    private String expression;
    @JsonProperty
    private String expressionColumn;
    @JsonProperty
    private BoundaryType boundaryType;
    @JsonProperty
    private int intervals;
    @JsonProperty
    private PagingConfig.PageType pagingType;
    @JsonProperty
    private int pagingSize;
    // not serdes'able.
    private TagSet tagSet;

    public Builder setOperation(final Operation operation) {
      this.operation = operation;
      return this;
    }

    public Builder setTags(final List<String> tags) {
      this.tags = tags;
      return this;
    }

    @JsonIgnore
    public Builder setTagSet(final TagSet tag_set) {
      this.tagSet = tag_set;
      return this;
    }

    public Builder setTagColumn(final String tag_column) {
      this.tagColumn = tag_column;
      return this;
    }

    public Builder setInterval(final String interval) {
      this.interval = interval;
      return this;
    }

    public Builder setFilterExpression(final String filter_expression) {
      this.filterExpression = filter_expression;
      return this;
    }

    public Builder setSummaryTypes(final List<SummaryType> summary_types) {
      this.summaryTypes = summary_types;
      return this;
    }

    public Builder setSummaryMask(final int summary_mask) {
      this.summaryMask = summary_mask;
      return this;
    }

    public Builder setCalculationBasis(final CalculationBasis basis) {
      this.calculationBasis = basis;
      return this;
    }

    public Builder setTimestampCalculation(final TimestampCalculation time_type) {
      this.timestampCalculation = time_type;
      return this;
    }

    public Builder setSampleType(final ExpressionSampleType sample_type) {
      this.sampleType = sample_type;
      return this;
    }

    public Builder setFilterInterval(final String filter_interval) {
      this.filterInterval = filter_interval;
      return this;
    }

    public Builder setExpression(final String expression) {
      this.expression = expression;
      return this;
    }

    public Builder setExpressionColumn(final String expression_column) {
      this.expressionColumn = expression_column;
      return this;
    }

    public Builder setBoundaryType(final BoundaryType boundary_type) {
      this.boundaryType = boundary_type;
      return this;
    }

    public Builder setIntervals(final int intervals) {
      this.intervals = intervals;
      return this;
    }

    public Builder setPagingType(final PagingConfig.PageType paging_type) {
      this.pagingType = paging_type;
      return this;
    }

    public Builder setPagingSize(final int paging_size) {
      this.pagingSize = paging_size;
      return this;
    }

    /**
     * Validates and builds the request.
     * @return The request.
     * @throws IllegalArgumentException if the request was incomplete for
     * its operation.
     */
    public ExtractRequest build() {
      return new ExtractRequest(this);
    }
  }
}
