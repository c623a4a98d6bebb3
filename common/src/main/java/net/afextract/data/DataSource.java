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
package net.afextract.data;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Set;

import net.afextract.exceptions.DataSourceException;

/**
 * The external asset framework and archive the engine reads from. 
 * Implementations own the connection, the wire protocol and all of the
 * numerical work. The engine only shapes and orchestrates.
 * <p>
 * All times going in and coming out are in the source's native UTC. Any
 * failure should surface as a {@link DataSourceException} or a runtime
 * exception that the caller will wrap. Calls may be made concurrently from
 * worker threads.
 * 
 * @since 1.0
 */
public interface DataSource {

  /**
   * Searches for root nodes.
   * @param query A source specific query, e.g. a name pattern.
   * @param start An opaque, possibly relative, start time such as "*-1d".
   * @param end An opaque, possibly relative, end time such as "*".
   * @param template_filter An optional template name to filter on.
   * @param max_count The max number of nodes to return.
   * @return A non-null, possibly empty list of nodes.
   */
  List<Node> findNodes(final String query, 
                       final String start, 
                       final String end,
                       final String template_filter,
                       final int max_count);
  
  /**
   * Loads the descendants of the given roots down to the given depth. The
   * roots themselves need not be included.
   * @param roots A non-null list of roots.
   * @param depth How many levels below the roots to load.
   * @param max_count The max number of nodes to return.
   * @return A non-null list of descendants.
   */
  List<Node> loadDescendants(final List<Node> roots, 
                             final int depth, 
                             final int max_count);
  
  /**
   * Resolves a tag query, e.g. a name or pattern, to tags.
   * @param query A non-null query.
   * @return A non-null, possibly empty, list of tags.
   */
  List<Tag> findTags(final String query);
  
  /**
   * Reads a single attribute value of a node.
   * @param node A non-null node.
   * @param attribute A non-null attribute name.
   * @return The value, may be null.
   */
  Object attributeValue(final Node node, final String attribute);
  
  /**
   * @param node A non-null node.
   * @return The names of the elements referenced by the node, possibly
   * empty.
   */
  List<String> referencedElements(final Node node);
  
  /**
   * Fetches samples interpolated at a fixed interval.
   * @param tags A non-null, non-empty set of tags.
   * @param start The start of the range.
   * @param end The end of the range.
   * @param interval The sampling interval, e.g. "1m".
   * @param filter_expression An optional filter expression.
   * @param paging A paging hint.
   * @return The samples per tag.
   */
  Map<Tag, List<Sample>> interpolatedValues(final TagSet tags,
                                            final Instant start,
                                            final Instant end,
                                            final String interval,
                                            final String filter_expression,
                                            final PagingConfig paging);
  
  /**
   * Fetches the archived samples.
   * @param tags A non-null, non-empty set of tags.
   * @param start The start of the range.
   * @param end The end of the range.
   * @param filter_expression An optional filter expression.
   * @param boundary Which edge samples to include.
   * @param paging A paging hint.
   * @return The samples per tag.
   */
  Map<Tag, List<Sample>> recordedValues(final TagSet tags,
                                        final Instant start,
                                        final Instant end,
                                        final String filter_expression,
                                        final BoundaryType boundary,
                                        final PagingConfig paging);
  
  /**
   * Fetches samples decimated for plotting.
   * @param tags A non-null, non-empty set of tags.
   * @param start The start of the range.
   * @param end The end of the range.
   * @param intervals The number of plot intervals.
   * @param paging A paging hint.
   * @return The samples per tag.
   */
  Map<Tag, List<Sample>> plotValues(final TagSet tags,
                                    final Instant start,
                                    final Instant end,
                                    final int intervals,
                                    final PagingConfig paging);
  
  /**
   * Computes summaries over the whole range.
   * @param tags A non-null, non-empty set of tags.
   * @param start The start of the range.
   * @param end The end of the range.
   * @param types The summaries to compute.
   * @param basis The calculation basis.
   * @param time_type Which timestamp to report.
   * @param paging A paging hint.
   * @return The summaries.
   */
  List<SummaryValue> summary(final TagSet tags,
                             final Instant start,
                             final Instant end,
                             final Set<SummaryType> types,
                             final CalculationBasis basis,
                             final TimestampCalculation time_type,
                             final PagingConfig paging);
  
  /**
   * Computes summaries per interval over the range.
   * @param tags A non-null, non-empty set of tags.
   * @param start The start of the range.
   * @param end The end of the range.
   * @param interval The summary interval.
   * @param types The summaries to compute.
   * @param basis The calculation basis.
   * @param time_type Which timestamp to report.
   * @param paging A paging hint.
   * @return The summaries.
   */
  List<SummaryValue> summaries(final TagSet tags,
                               final Instant start,
                               final Instant end,
                               final String interval,
                               final Set<SummaryType> types,
                               final CalculationBasis basis,
                               final TimestampCalculation time_type,
                               final PagingConfig paging);
  
  /**
   * Computes summaries per interval only over the periods where the filter
   * expression holds.
   * @param tags A non-null, non-empty set of tags.
   * @param start The start of the range.
   * @param end The end of the range.
   * @param interval The summary interval.
   * @param types The summaries to compute.
   * @param filter_expression The filter expression.
   * @param basis The calculation basis.
   * @param sample_type How the filter is sampled.
   * @param filter_interval The filter sampling interval, may be null.
   * @param time_type Which timestamp to report.
   * @param paging A paging hint.
   * @return The summaries.
   */
  List<SummaryValue> filteredSummaries(final TagSet tags,
                                       final Instant start,
                                       final Instant end,
                                       final String interval,
                                       final Set<SummaryType> types,
                                       final String filter_expression,
                                       final CalculationBasis basis,
                                       final ExpressionSampleType sample_type,
                                       final String filter_interval,
                                       final TimestampCalculation time_type,
                                       final PagingConfig paging);
  
  /**
   * Computes summaries of an expression, e.g. {@code 'tag1' - 'tag2'}.
   * @param expression The non-null expression.
   * @param start The start of the range.
   * @param end The end of the range.
   * @param interval The summary interval, may be null for the whole range.
   * @param types The summaries to compute.
   * @param basis The calculation basis.
   * @param time_type Which timestamp to report.
   * @param sample_type How the expression is sampled.
   * @param sample_interval The sampling interval, may be null.
   * @return The summaries with null tag names.
   */
  List<SummaryValue> calculationSummary(final String expression,
                                        final Instant start,
                                        final Instant end,
                                        final String interval,
                                        final Set<SummaryType> types,
                                        final CalculationBasis basis,
                                        final TimestampCalculation time_type,
                                        final ExpressionSampleType sample_type,
                                        final String sample_interval);
  
  /**
   * The source's notion of "now", used for rows still in progress.
   * @param zone The display zone.
   * @return The current time in the zone.
   */
  default ZonedDateTime currentTime(final ZoneId zone) {
    return ZonedDateTime.now(zone);
  }
}
