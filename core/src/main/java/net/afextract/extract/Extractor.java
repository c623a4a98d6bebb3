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

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Lists;

import net.afextract.data.DataSource;
import net.afextract.data.Node;
import net.afextract.data.PagingConfig;
import net.afextract.data.Sample;
import net.afextract.data.SummaryValue;
import net.afextract.data.Tag;
import net.afextract.data.TagSet;
import net.afextract.data.TimeSeriesPoint;
import net.afextract.exceptions.DataSourceException;
import net.afextract.exceptions.InvalidShapeException;
import net.afextract.hierarchy.CondensedTable;
import net.afextract.table.Columns;
import net.afextract.table.ResultTable;
import net.afextract.utils.Config;
import net.afextract.utils.DateTime;

/**
 * Runs extractions over a scope, one data source call per row or per
 * procedure, and reshapes the results into tables.
 * <p>
 * Per row extractions work on a {@link net.afextract.hierarchy.HierarchyTable}
 * or a {@link CondensedTable}. Procedure level extractions need a condensed
 * table so each returned sample can be attached back to the leaf node whose
 * range contains it.
 * <p>
 * Every timestamp handed out is in the configured display zone. Samples at
 * the source's sentinel max date are dropped and summary timestamps at the
 * sentinel are left missing. Data source failures are wrapped in a
 * {@link DataSourceException} with the range and expression and are never
 * retried.
 *
 * @since 1.0
 */
public class Extractor {
  private static final Logger LOG = LoggerFactory.getLogger(Extractor.class);

  /** The source. */
  private final DataSource data_source;

  /** Resolves tag specs. */
  private final TagResolver resolver;

  /** The display zone. */
  private final ZoneId zone;

  /** Warn above this row duration in ms. */
  private final long warn_duration;

  /** Warn above this many rows. */
  private final int warn_rows;

  /** Paging when the request has none. */
  private final PagingConfig default_paging;

  /**
   * Default ctor.
   * @param data_source A non-null data source.
   * @param config A non-null config.
   */
  public Extractor(final DataSource data_source, final Config config) {
    if (data_source == null) {
      throw new IllegalArgumentException("Data source cannot be null.");
    }
    if (config == null) {
      throw new IllegalArgumentException("Config cannot be null.");
    }
    this.data_source = data_source;
    resolver = new TagResolver(data_source);
    zone = config.getTimeZone();
    warn_duration = DateTime.parseDuration(
        config.getString(Config.WARN_DURATION_KEY));
    warn_rows = config.getInt(Config.WARN_ROWS_KEY);
    default_paging = PagingConfig.fromConfig(config);
  }

  /** @return The display zone. */
  public ZoneId zone() {
    return zone;
  }

  /** @return The tag resolver. */
  public TagResolver resolver() {
    return resolver;
  }

  /**
   * Runs a per row extraction, dispatching on the request's operation.
   * @param scope A non-null scope.
   * @param request A non-null request.
   * @return The result table.
   * @throws IllegalArgumentException if the operation does not run per row.
   */
  public ResultTable execute(final ExtractionScope scope,
                             final ExtractRequest request) {
    switch (request.operation()) {
    case INTERPOLATED_EXTRACT:
      return interpolatedExtract(scope, request);
    case SUMMARY_EXTRACT:
      return summaryExtract(scope, request);
    case FILTERED_SUMMARY_EXTRACT:
      return filteredSummaryExtract(scope, request);
    case CALC_SUMMARY_EXTRACT:
      return calcSummaryExtract(scope, request);
    default:
      throw new IllegalArgumentException("Operation "
          + request.operation() + " does not run per row");
    }
  }

  /**
   * Runs an extraction over a set of tags and an explicit range.
   * @param tags A non-null set of tags.
   * @param start The non-null start.
   * @param end The non-null end.
   * @param request A non-null request.
   * @return The result table.
   * @throws IllegalArgumentException if the operation does not run over a
   * tag set.
   */
  public ResultTable execute(final TagSet tags,
                             final ZonedDateTime start,
                             final ZonedDateTime end,
                             final ExtractRequest request) {
    switch (request.operation()) {
    case INTERPOLATED_EXTRACT:
      return tagInterpolatedExtract(tags, start, end, request);
    case SUMMARY_EXTRACT:
      return tagSummaryExtract(tags, start, end, request);
    default:
      throw new IllegalArgumentException("Operation "
          + request.operation() + " does not run over a tag set");
    }
  }

  /**
   * Interpolated values over each row's range. Tags given for every row
   * produce one column per tag, tags from a column produce one row per tag
   * and timestamp.
   * @param scope A non-null scope.
   * @param request A non-null request for interpolated values.
   * @return The result table.
   */
  public ResultTable interpolatedExtract(final ExtractionScope scope,
                                         final ExtractRequest request) {
    checkOperation(request, Operation.INTERPOLATED_EXTRACT);
    final List<ScopedRow> rows = scope.scopedRows();
    final ZonedDateTime now = data_source.currentTime(zone);
    checkLoad(rows, now, request.operation());
    final PagingConfig paging = paging(request);

    if (request.tagSpec().isPerRow()) {
      final List<TagSet> per_row = resolver.resolvePerRow(scope, rows,
          request.tagSpec().column(), TagResolver.CellMode.TAG_LIST);
      final ResultTable result = new ResultTable(Lists.newArrayList(
          Columns.PROCEDURE, Columns.NODE, Columns.TAG, Columns.TIME,
          Columns.VALUE));
      for (int i = 0; i < rows.size(); i++) {
        final ScopedRow row = rows.get(i);
        final TagSet tags = per_row.get(i);
        final ZonedDateTime start = start(row);
        final ZonedDateTime end = end(row, now);
        final Map<Tag, List<Sample>> data = fetch("interpolated values for "
            + row.node().path(), start, end, request.filterExpression(),
            () -> data_source.interpolatedValues(tags, start.toInstant(),
                end.toInstant(), request.interval(),
                request.filterExpression(), paging));
        for (final Tag tag : tags) {
          for (final TimeSeriesPoint point : points(data, tag)) {
            final Map<String, Object> out = newRow(row);
            out.put(Columns.TAG, tag.name());
            out.put(Columns.TIME, point.timestamp());
            out.put(Columns.VALUE, point.value());
            result.addRow(out);
          }
        }
      }
      return result;
    }

    final TagSet tags = resolver.resolve(request.tagSpec());
    final ResultTable result = new ResultTable(wideColumns(
        Lists.newArrayList(Columns.PROCEDURE, Columns.NODE, Columns.TIME),
        tags));
    for (final ScopedRow row : rows) {
      final ZonedDateTime start = start(row);
      final ZonedDateTime end = end(row, now);
      final Map<Tag, List<Sample>> data = fetch("interpolated values for "
          + row.node().path(), start, end, request.filterExpression(),
          () -> data_source.interpolatedValues(tags, start.toInstant(),
              end.toInstant(), request.interval(), request.filterExpression(),
              paging));
      for (final Map.Entry<ZonedDateTime, Map<String, Object>> entry :
          pivot(data, tags).entrySet()) {
        final Map<String, Object> out = newRow(row);
        out.put(Columns.TIME, entry.getKey());
        out.putAll(entry.getValue());
        result.addRow(out);
      }
    }
    return result;
  }

  /**
   * Summaries over each row's range, one output row per tag and summary, or
   * per tag, summary and interval when the request has an interval. Tags
   * from a column must be one per cell.
   * @param scope A non-null scope.
   * @param request A non-null request for summaries.
   * @return The result table.
   */
  public ResultTable summaryExtract(final ExtractionScope scope,
                                    final ExtractRequest request) {
    checkOperation(request, Operation.SUMMARY_EXTRACT);
    final List<ScopedRow> rows = scope.scopedRows();
    final ZonedDateTime now = data_source.currentTime(zone);
    checkLoad(rows, now, request.operation());
    final PagingConfig paging = paging(request);
    final List<TagSet> per_row = tagsPerRow(scope, rows, request);

    final ResultTable result = new ResultTable(summaryColumns(true));
    for (int i = 0; i < rows.size(); i++) {
      final ScopedRow row = rows.get(i);
      final TagSet tags = per_row.get(i);
      final ZonedDateTime start = start(row);
      final ZonedDateTime end = end(row, now);
      final List<SummaryValue> values = fetch("summaries for "
          + row.node().path(), start, end, null,
          () -> summaries(tags, start, end, request, paging));
      addSummaries(result, row, values, true);
    }
    return result;
  }

  /**
   * Interval summaries over each row's range restricted to the periods where
   * the filter expression holds.
   * @param scope A non-null scope.
   * @param request A non-null request for filtered summaries.
   * @return The result table.
   */
  public ResultTable filteredSummaryExtract(final ExtractionScope scope,
                                            final ExtractRequest request) {
    checkOperation(request, Operation.FILTERED_SUMMARY_EXTRACT);
    final List<ScopedRow> rows = scope.scopedRows();
    final ZonedDateTime now = data_source.currentTime(zone);
    checkLoad(rows, now, request.operation());
    final PagingConfig paging = paging(request);
    final List<TagSet> per_row = tagsPerRow(scope, rows, request);

    final ResultTable result = new ResultTable(summaryColumns(true));
    for (int i = 0; i < rows.size(); i++) {
      final ScopedRow row = rows.get(i);
      final TagSet tags = per_row.get(i);
      final ZonedDateTime start = start(row);
      final ZonedDateTime end = end(row, now);
      final List<SummaryValue> values = fetch("filtered summaries for "
          + row.node().path(), start, end, request.filterExpression(),
          () -> data_source.filteredSummaries(tags, start.toInstant(),
              end.toInstant(), request.interval(), request.summaryTypes(),
              request.filterExpression(), request.calculationBasis(),
              request.sampleType(), request.filterInterval(),
              request.timestampCalculation(), paging));
      addSummaries(result, row, values, true);
    }
    return result;
  }

  /**
   * Summaries of an expression over each row's range. The expression is
   * either fixed or read from a column of each row.
   * @param scope A non-null scope.
   * @param request A non-null request for expression summaries.
   * @return The result table.
   * @throws InvalidShapeException if the expression column is missing or a
   * cell is empty.
   */
  public ResultTable calcSummaryExtract(final ExtractionScope scope,
                                        final ExtractRequest request) {
    checkOperation(request, Operation.CALC_SUMMARY_EXTRACT);
    final String column = request.expressionColumn();
    if (column != null && !scope.hasColumn(column)) {
      throw new InvalidShapeException("The column option was set but "
          + column + " is not a valid column", column);
    }
    final List<ScopedRow> rows = scope.scopedRows();
    final ZonedDateTime now = data_source.currentTime(zone);
    checkLoad(rows, now, request.operation());

    final ResultTable result = new ResultTable(summaryColumns(false));
    for (final ScopedRow row : rows) {
      final String expression;
      if (column == null) {
        expression = request.expression();
      } else {
        final Object cell = row.values().get(column);
        if (cell == null || cell.toString().trim().isEmpty()) {
          throw new InvalidShapeException("Empty expression in column "
              + column + " at row " + row.index(), column);
        }
        expression = cell.toString().trim();
      }
      final ZonedDateTime start = start(row);
      final ZonedDateTime end = end(row, now);
      final List<SummaryValue> values = fetch("expression summaries for "
          + row.node().path(), start, end, expression,
          () -> data_source.calculationSummary(expression, start.toInstant(),
              end.toInstant(), request.interval(), request.summaryTypes(),
              request.calculationBasis(), request.timestampCalculation(),
              request.sampleType(), request.filterInterval()));
      addSummaries(result, row, values, false);
    }
    return result;
  }

  /**
   * Interpolated values over the whole span of each procedure, from the
   * earliest starting member's start to the last member's end. Each sample
   * is attached to the member whose range contains it and the result is
   * sorted by time.
   * @param table A non-null condensed table.
   * @param request A non-null request for continuous interpolated values.
   * @return The result table.
   */
  public ResultTable continuousInterpolatedExtract(final CondensedTable table,
                                                   final ExtractRequest request) {
    checkOperation(request, Operation.CONTINUOUS_INTERPOLATED_EXTRACT);
    final TagSet tags = procedureTags(request);
    final List<ScopedRow> rows = table.scopedRows();
    final ZonedDateTime now = data_source.currentTime(zone);
    checkLoad(rows, now, request.operation());
    final PagingConfig paging = paging(request);

    final ResultTable result = new ResultTable(wideColumns(
        Lists.newArrayList(Columns.PROCEDURE, Columns.NODE, Columns.TIME),
        tags));
    for (final Map.Entry<String, List<ScopedRow>> group :
        groupByProcedure(rows).entrySet()) {
      final List<ScopedRow> members = group.getValue();
      final ZonedDateTime start = start(members.get(0));
      final ZonedDateTime end = end(members.get(members.size() - 1), now);
      final Map<Tag, List<Sample>> data = fetch("interpolated values for "
          + group.getKey(), start, end, request.filterExpression(),
          () -> data_source.interpolatedValues(tags, start.toInstant(),
              end.toInstant(), request.interval(), request.filterExpression(),
              paging));
      for (final Map.Entry<ZonedDateTime, Map<String, Object>> entry :
          pivot(data, tags).entrySet()) {
        final Map<String, Object> out = new LinkedHashMap<String, Object>();
        out.put(Columns.PROCEDURE, group.getKey());
        out.put(Columns.NODE, nodeName(containing(members, entry.getKey(), now)));
        out.put(Columns.TIME, entry.getKey());
        out.putAll(entry.getValue());
        result.addRow(out);
      }
    }
    return result.sortBy(Columns.TIME);
  }

  /**
   * Archived values over the whole span of each procedure.
   * @param table A non-null condensed table.
   * @param request A non-null request for recorded values.
   * @return Procedure to tag name to a table of node, time and value.
   */
  public Map<String, Map<String, ResultTable>> recordedExtract(
      final CondensedTable table, final ExtractRequest request) {
    checkOperation(request, Operation.RECORDED_EXTRACT);
    final PagingConfig paging = paging(request);
    return perProcedure(table, request, (tags, start, end) ->
        data_source.recordedValues(tags, start, end,
            request.filterExpression(), request.boundaryType(), paging));
  }

  /**
   * Plot decimated values over the whole span of each procedure.
   * @param table A non-null condensed table.
   * @param request A non-null request for plot values.
   * @return Procedure to tag name to a table of node, time and value.
   */
  public Map<String, Map<String, ResultTable>> plotExtract(
      final CondensedTable table, final ExtractRequest request) {
    checkOperation(request, Operation.PLOT_EXTRACT);
    final PagingConfig paging = paging(request);
    return perProcedure(table, request, (tags, start, end) ->
        data_source.plotValues(tags, start, end, request.intervals(), paging));
  }

  /**
   * Summaries for a set of tags over one range.
   * @param tags A non-null, non-empty set of tags.
   * @param start The non-null start.
   * @param end The non-null end.
   * @param request A non-null request for summaries.
   * @return A table of tag, summary, value and time.
   */
  public ResultTable tagSummaryExtract(final TagSet tags,
                                       final ZonedDateTime start,
                                       final ZonedDateTime end,
                                       final ExtractRequest request) {
    checkOperation(request, Operation.SUMMARY_EXTRACT);
    checkRange(start, end);
    final ResultTable result = new ResultTable(Lists.newArrayList(
        Columns.TAG, Columns.SUMMARY, Columns.VALUE, Columns.TIME));
    final PagingConfig paging = paging(request);
    final List<SummaryValue> values = fetch("summaries for " + tags,
        start, end, null,
        () -> summaries(tags, start, end, request, paging));
    for (final SummaryValue value : values) {
      final Map<String, Object> out = new LinkedHashMap<String, Object>();
      out.put(Columns.TAG, value.tag());
      out.put(Columns.SUMMARY, value.type().name());
      out.put(Columns.VALUE, value.value());
      out.put(Columns.TIME, DateTime.toDisplay(value.timestamp(), zone));
      result.addRow(out);
    }
    return result;
  }

  /**
   * Interpolated values for a set of tags over one range.
   * @param tags A non-null, non-empty set of tags.
   * @param start The non-null start.
   * @param end The non-null end.
   * @param request A non-null request for interpolated values.
   * @return A table with a time column and a column per tag.
   */
  public ResultTable tagInterpolatedExtract(final TagSet tags,
                                            final ZonedDateTime start,
                                            final ZonedDateTime end,
                                            final ExtractRequest request) {
    checkOperation(request, Operation.INTERPOLATED_EXTRACT);
    checkRange(start, end);
    final ResultTable result = new ResultTable(wideColumns(
        Lists.newArrayList(Columns.TIME), tags));
    final Map<Tag, List<Sample>> data = fetch("interpolated values for "
        + tags, start, end, request.filterExpression(),
        () -> data_source.interpolatedValues(tags, start.toInstant(),
            end.toInstant(), request.interval(), request.filterExpression(),
            paging(request)));
    for (final Map.Entry<ZonedDateTime, Map<String, Object>> entry :
        pivot(data, tags).entrySet()) {
      final Map<String, Object> out = new LinkedHashMap<String, Object>();
      out.put(Columns.TIME, entry.getKey());
      out.putAll(entry.getValue());
      result.addRow(out);
    }
    return result;
  }

  /** Fetches samples for one procedure's span. */
  interface SpanFetch {
    Map<Tag, List<Sample>> fetch(final TagSet tags,
                                 final Instant start,
                                 final Instant end);
  }

  /**
   * Shared body of the per procedure, per tag extractions.
   * @param table The condensed table.
   * @param request The request.
   * @param span_fetch The data source call.
   * @return Procedure to tag name to a table of node, time and value.
   */
  private Map<String, Map<String, ResultTable>> perProcedure(
      final CondensedTable table,
      final ExtractRequest request,
      final SpanFetch span_fetch) {
    final TagSet tags = procedureTags(request);
    final List<ScopedRow> rows = table.scopedRows();
    final ZonedDateTime now = data_source.currentTime(zone);
    checkLoad(rows, now, request.operation());

    final Map<String, Map<String, ResultTable>> results =
        new LinkedHashMap<String, Map<String, ResultTable>>();
    for (final Map.Entry<String, List<ScopedRow>> group :
        groupByProcedure(rows).entrySet()) {
      final List<ScopedRow> members = group.getValue();
      final ZonedDateTime start = start(members.get(0));
      final ZonedDateTime end = end(members.get(members.size() - 1), now);
      final Map<Tag, List<Sample>> data = fetch(
          request.operation() + " for " + group.getKey(), start, end,
          request.filterExpression(),
          () -> span_fetch.fetch(tags, start.toInstant(), end.toInstant()));

      final Map<String, ResultTable> per_tag =
          new LinkedHashMap<String, ResultTable>();
      for (final Tag tag : tags) {
        final ResultTable result = new ResultTable(Lists.newArrayList(
            Columns.NODE, Columns.TIME, Columns.VALUE));
        for (final TimeSeriesPoint point : points(data, tag)) {
          final Map<String, Object> out = new LinkedHashMap<String, Object>();
          out.put(Columns.NODE,
              nodeName(containing(members, point.timestamp(), now)));
          out.put(Columns.TIME, point.timestamp());
          out.put(Columns.VALUE, point.value());
          result.addRow(out);
        }
        per_tag.put(tag.name(), result);
      }
      results.put(group.getKey(), per_tag);
    }
    return results;
  }

  /**
   * Groups rows by procedure in order of first appearance, each group
   * sorted by start time.
   * @param rows The rows.
   * @return The groups.
   */
  private Map<String, List<ScopedRow>> groupByProcedure(
      final List<ScopedRow> rows) {
    final List<ScopedRow> sorted = Lists.newArrayList(rows);
    for (final ScopedRow row : sorted) {
      start(row);
    }
    Collections.sort(sorted, new Comparator<ScopedRow>() {
      @Override
      public int compare(final ScopedRow a, final ScopedRow b) {
        return a.start().compareTo(b.start());
      }
    });
    final Map<String, List<ScopedRow>> groups =
        new LinkedHashMap<String, List<ScopedRow>>();
    for (final ScopedRow row : sorted) {
      List<ScopedRow> group = groups.get(row.procedure());
      if (group == null) {
        group = Lists.newArrayList();
        groups.put(row.procedure(), group);
      }
      group.add(row);
    }
    return groups;
  }

  /**
   * Finds the member whose range contains the timestamp. When ranges
   * overlap the last match in start order wins.
   * @param members The group members.
   * @param timestamp The timestamp.
   * @param now The end for open members.
   * @return The node or null if no member contains the timestamp.
   */
  private static Node containing(final List<ScopedRow> members,
                                 final ZonedDateTime timestamp,
                                 final ZonedDateTime now) {
    Node match = null;
    for (final ScopedRow member : members) {
      final ZonedDateTime end = member.end() == null ? now : member.end();
      if (!timestamp.isBefore(member.start()) && !timestamp.isAfter(end)) {
        match = member.node();
      }
    }
    return match;
  }

  /**
   * @param request The request.
   * @return The tags for a per procedure extraction.
   * @throws InvalidShapeException if the tags come from a column.
   */
  private TagSet procedureTags(final ExtractRequest request) {
    if (request.tagSpec().isPerRow()) {
      throw new InvalidShapeException(request.operation()
          + " needs the same tags for every row, not a tag column",
          request.tagSpec().column());
    }
    return resolver.resolve(request.tagSpec());
  }

  /**
   * @param scope The scope.
   * @param rows The rows.
   * @param request The request.
   * @return A tag set per row, single tag per cell for column specs.
   */
  private List<TagSet> tagsPerRow(final ExtractionScope scope,
                                  final List<ScopedRow> rows,
                                  final ExtractRequest request) {
    if (request.tagSpec().isPerRow()) {
      return resolver.resolvePerRow(scope, rows, request.tagSpec().column(),
          TagResolver.CellMode.SINGLE_TAG);
    }
    return Collections.nCopies(rows.size(),
        resolver.resolve(request.tagSpec()));
  }

  /**
   * One summary per type over the range, or one per interval when the
   * request has an interval.
   */
  private List<SummaryValue> summaries(final TagSet tags,
                                       final ZonedDateTime start,
                                       final ZonedDateTime end,
                                       final ExtractRequest request,
                                       final PagingConfig paging) {
    if (request.interval() == null) {
      return data_source.summary(tags, start.toInstant(), end.toInstant(),
          request.summaryTypes(), request.calculationBasis(),
          request.timestampCalculation(), paging);
    }
    return data_source.summaries(tags, start.toInstant(), end.toInstant(),
        request.interval(), request.summaryTypes(), request.calculationBasis(),
        request.timestampCalculation(), paging);
  }

  /**
   * Appends summary values.
   * @param result The table to append to.
   * @param row The row the values belong to.
   * @param values The values.
   * @param with_tag Whether to include the tag column.
   */
  private void addSummaries(final ResultTable result,
                            final ScopedRow row,
                            final List<SummaryValue> values,
                            final boolean with_tag) {
    for (final SummaryValue value : values) {
      final Map<String, Object> out = newRow(row);
      if (with_tag) {
        out.put(Columns.TAG, value.tag());
      }
      out.put(Columns.SUMMARY, value.type().name());
      out.put(Columns.VALUE, value.value());
      out.put(Columns.TIME, DateTime.toDisplay(value.timestamp(), zone));
      result.addRow(out);
    }
  }

  /**
   * Lines the samples of the tags up by timestamp.
   * @param data The samples per tag.
   * @param tags The tags in column order.
   * @return Time to tag name to value, sorted by time.
   */
  private TreeMap<ZonedDateTime, Map<String, Object>> pivot(
      final Map<Tag, List<Sample>> data,
      final TagSet tags) {
    final TreeMap<ZonedDateTime, Map<String, Object>> pivoted =
        new TreeMap<ZonedDateTime, Map<String, Object>>();
    for (final Tag tag : tags) {
      for (final TimeSeriesPoint point : points(data, tag)) {
        Map<String, Object> values = pivoted.get(point.timestamp());
        if (values == null) {
          values = new LinkedHashMap<String, Object>();
          for (final Tag t : tags) {
            values.put(t.name(), null);
          }
          pivoted.put(point.timestamp(), values);
        }
        values.put(tag.name(), point.value());
      }
    }
    return pivoted;
  }

  /**
   * @param data The samples per tag.
   * @param tag The tag.
   * @return The converted points, without sentinel samples.
   */
  private List<TimeSeriesPoint> points(final Map<Tag, List<Sample>> data,
                                       final Tag tag) {
    final List<Sample> samples = data == null ? null : data.get(tag);
    if (samples == null) {
      return Collections.emptyList();
    }
    final List<TimeSeriesPoint> points =
        Lists.newArrayListWithCapacity(samples.size());
    for (final Sample sample : samples) {
      final TimeSeriesPoint point = TimeSeriesPoint.fromSample(sample, zone);
      if (point != null) {
        points.add(point);
      }
    }
    return points;
  }

  /** The data source call to wrap. */
  interface Fetch<T> {
    T call();
  }

  /**
   * Calls the data source, wrapping failures with the range and expression.
   * @param what A description for the error message.
   * @param start The start of the range.
   * @param end The end of the range.
   * @param expression The expression in play, may be null.
   * @param fetch The call.
   * @return The result.
   * @throws DataSourceException if the call failed.
   */
  private <T> T fetch(final String what,
                      final ZonedDateTime start,
                      final ZonedDateTime end,
                      final String expression,
                      final Fetch<T> fetch) {
    if (LOG.isDebugEnabled()) {
      LOG.debug("Fetching {} from {} to {}", what, start, end);
    }
    try {
      return fetch.call();
    } catch (DataSourceException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new DataSourceException("Failed fetching " + what,
          DateTime.toSource(start), DateTime.toSource(end), expression, e);
    }
  }

  /**
   * Logs a warning if the request looks expensive.
   * @param rows The rows.
   * @param now The end of open rows.
   * @param operation The operation.
   */
  private void checkLoad(final List<ScopedRow> rows,
                         final ZonedDateTime now,
                         final Operation operation) {
    if (rows.size() > warn_rows) {
      LOG.warn("{} over {} rows, more than {}, this may take a while",
          operation, rows.size(), warn_rows);
    }
    long longest = 0;
    for (final ScopedRow row : rows) {
      if (row.start() == null) {
        continue;
      }
      final ZonedDateTime end = row.end() == null ? now : row.end();
      longest = Math.max(longest,
          end.toInstant().toEpochMilli() - row.start().toInstant().toEpochMilli());
    }
    if (longest > warn_duration) {
      LOG.warn("{} spans up to {} days, more than {} days, this may take "
          + "a while", operation, longest / 86400000L, warn_duration / 86400000L);
    }
  }

  private static void checkOperation(final ExtractRequest request,
                                     final Operation operation) {
    if (request == null) {
      throw new IllegalArgumentException("Request cannot be null.");
    }
    if (request.operation() != operation) {
      throw new IllegalArgumentException("Request for "
          + request.operation() + " cannot run as " + operation);
    }
  }

  private static void checkRange(final ZonedDateTime start,
                                 final ZonedDateTime end) {
    if (start == null || end == null) {
      throw new IllegalArgumentException("Start and end cannot be null.");
    }
    if (end.isBefore(start)) {
      throw new IllegalArgumentException("End " + end
          + " cannot be before start " + start);
    }
  }

  /**
   * @param row A row.
   * @return The start.
   * @throws InvalidShapeException if the row has no start.
   */
  private static ZonedDateTime start(final ScopedRow row) {
    if (row.start() == null) {
      throw new InvalidShapeException("Row " + row.index() + " ("
          + row.node().path() + ") has no start time", Columns.START);
    }
    return row.start();
  }

  private static ZonedDateTime end(final ScopedRow row,
                                   final ZonedDateTime now) {
    return row.end() == null ? now : row.end();
  }

  private static String nodeName(final Node node) {
    return node == null ? null : node.name();
  }

  private static Map<String, Object> newRow(final ScopedRow row) {
    final Map<String, Object> out = new LinkedHashMap<String, Object>();
    out.put(Columns.PROCEDURE, row.procedure());
    out.put(Columns.NODE, row.node().name());
    return out;
  }

  private static List<String> summaryColumns(final boolean with_tag) {
    final List<String> columns = Lists.newArrayList(
        Columns.PROCEDURE, Columns.NODE);
    if (with_tag) {
      columns.add(Columns.TAG);
    }
    columns.add(Columns.SUMMARY);
    columns.add(Columns.VALUE);
    columns.add(Columns.TIME);
    return columns;
  }

  private static List<String> wideColumns(final List<String> columns,
                                          final TagSet tags) {
    columns.addAll(tags.names());
    return columns;
  }

  private PagingConfig paging(final ExtractRequest request) {
    return request.paging() == null ? default_paging : request.paging();
  }
}
