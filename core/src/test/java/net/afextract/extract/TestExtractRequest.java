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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.EnumSet;

import org.junit.Test;

import com.google.common.collect.Lists;

import net.afextract.data.BoundaryType;
import net.afextract.data.CalculationBasis;
import net.afextract.data.ExpressionSampleType;
import net.afextract.data.PagingConfig;
import net.afextract.data.SummaryType;
import net.afextract.data.Tag;
import net.afextract.data.TagSet;
import net.afextract.data.TimestampCalculation;
import net.afextract.utils.JSON;

public class TestExtractRequest {

  @Test
  public void builderDefaults() throws Exception {
    final ExtractRequest request = ExtractRequest.newBuilder()
        .setOperation(Operation.SUMMARY_EXTRACT)
        .setTags(Lists.newArrayList("FIC101.PV"))
        .setSummaryTypes(Lists.newArrayList(SummaryType.AVERAGE))
        .build();
    assertEquals(Operation.SUMMARY_EXTRACT, request.operation());
    assertEquals(TagSpec.Type.IDENTIFIERS, request.tagSpec().type());
    assertEquals(Lists.newArrayList("FIC101.PV"),
        request.tagSpec().identifiers());
    assertEquals(EnumSet.of(SummaryType.AVERAGE), request.summaryTypes());
    assertEquals(CalculationBasis.TIME_WEIGHTED, request.calculationBasis());
    assertEquals(TimestampCalculation.AUTO, request.timestampCalculation());
    assertEquals(ExpressionSampleType.EXPRESSION_RECORDED_VALUES,
        request.sampleType());
    assertEquals(BoundaryType.INSIDE, request.boundaryType());
    assertNull(request.interval());
    assertNull(request.paging());
  }

  @Test
  public void builderSummaryMask() throws Exception {
    final ExtractRequest request = ExtractRequest.newBuilder()
        .setOperation(Operation.SUMMARY_EXTRACT)
        .setTagColumn("Tags [Phase]")
        .setSummaryTypes(Lists.newArrayList(SummaryType.COUNT))
        .setSummaryMask(1 | 8)
        .build();
    assertEquals(EnumSet.of(SummaryType.TOTAL, SummaryType.MAXIMUM,
        SummaryType.COUNT), request.summaryTypes());
    assertTrue(request.tagSpec().isPerRow());
    assertEquals("Tags [Phase]", request.tagSpec().column());
  }

  @Test
  public void builderPaging() throws Exception {
    ExtractRequest request = ExtractRequest.newBuilder()
        .setOperation(Operation.RECORDED_EXTRACT)
        .setTagSet(TagSet.of(new Tag("A", null)))
        .setPagingSize(50)
        .build();
    assertEquals(new PagingConfig(PagingConfig.PageType.EVENT_COUNT, 50),
        request.paging());
    assertEquals(TagSpec.Type.TAG_SET, request.tagSpec().type());

    request = ExtractRequest.newBuilder()
        .setOperation(Operation.RECORDED_EXTRACT)
        .setTags(Lists.newArrayList("A"))
        .setPagingType(PagingConfig.PageType.TAG_COUNT)
        .build();
    assertEquals(new PagingConfig(PagingConfig.PageType.TAG_COUNT, 1000),
        request.paging());
  }

  @Test
  public void builderValidation() throws Exception {
    // no operation
    assertInvalid(ExtractRequest.newBuilder()
        .setTags(Lists.newArrayList("A")));
    // no tags
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.RECORDED_EXTRACT));
    // two tag sources
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.RECORDED_EXTRACT)
        .setTags(Lists.newArrayList("A"))
        .setTagColumn("Tags"));
    // interpolation without interval
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.INTERPOLATED_EXTRACT)
        .setTags(Lists.newArrayList("A")));
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.CONTINUOUS_INTERPOLATED_EXTRACT)
        .setTags(Lists.newArrayList("A"))
        .setInterval(""));
    // summaries without types
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.SUMMARY_EXTRACT)
        .setTags(Lists.newArrayList("A")));
    // filtered without a filter
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.FILTERED_SUMMARY_EXTRACT)
        .setTags(Lists.newArrayList("A"))
        .setInterval("1h")
        .setSummaryTypes(Lists.newArrayList(SummaryType.TOTAL)));
    // calculation with both expression sources
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.CALC_SUMMARY_EXTRACT)
        .setSummaryTypes(Lists.newArrayList(SummaryType.TOTAL))
        .setExpression("'A' * 2")
        .setExpressionColumn("Expr"));
    // calculation with neither
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.CALC_SUMMARY_EXTRACT)
        .setSummaryTypes(Lists.newArrayList(SummaryType.TOTAL)));
    // plot without intervals
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.PLOT_EXTRACT)
        .setTags(Lists.newArrayList("A")));
    // bad mask
    assertInvalid(ExtractRequest.newBuilder()
        .setOperation(Operation.SUMMARY_EXTRACT)
        .setTags(Lists.newArrayList("A"))
        .setSummaryMask(1 << 20));
  }

  @Test
  public void builderCalcWithoutTags() throws Exception {
    final ExtractRequest request = ExtractRequest.newBuilder()
        .setOperation(Operation.CALC_SUMMARY_EXTRACT)
        .setSummaryTypes(Lists.newArrayList(SummaryType.TOTAL))
        .setExpressionColumn("Expression [Phase]")
        .build();
    assertNull(request.tagSpec());
    assertNull(request.expression());
    assertEquals("Expression [Phase]", request.expressionColumn());
  }

  @Test
  public void deserialize() throws Exception {
    final String json = "{\"operation\":\"FILTERED_SUMMARY_EXTRACT\","
        + "\"tags\":[\"FIC101.PV\",\"TIC201.PV\"],"
        + "\"interval\":\"1h\","
        + "\"filterExpression\":\"'FIC101.PV' > 5\","
        + "\"summaryTypes\":[\"AVERAGE\"],"
        + "\"summaryMask\":8,"
        + "\"calculationBasis\":\"EVENT_WEIGHTED\","
        + "\"sampleType\":\"INTERVAL\","
        + "\"filterInterval\":\"10m\","
        + "\"pagingType\":\"TAG_COUNT\","
        + "\"pagingSize\":5,"
        + "\"someFutureField\":true}";
    final ExtractRequest request = JSON.parseToObject(json,
        ExtractRequest.class);

    assertEquals(Operation.FILTERED_SUMMARY_EXTRACT, request.operation());
    assertEquals(Lists.newArrayList("FIC101.PV", "TIC201.PV"),
        request.tagSpec().identifiers());
    assertEquals("1h", request.interval());
    assertEquals("'FIC101.PV' > 5", request.filterExpression());
    assertEquals(EnumSet.of(SummaryType.AVERAGE, SummaryType.MAXIMUM),
        request.summaryTypes());
    assertEquals(CalculationBasis.EVENT_WEIGHTED, request.calculationBasis());
    assertEquals(ExpressionSampleType.INTERVAL, request.sampleType());
    assertEquals("10m", request.filterInterval());
    assertEquals(new PagingConfig(PagingConfig.PageType.TAG_COUNT, 5),
        request.paging());
  }

  @Test
  public void deserializeInvalid() throws Exception {
    try {
      JSON.parseToObject("{\"operation\":\"PLOT_EXTRACT\","
          + "\"tags\":[\"A\"]}", ExtractRequest.class);
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }

  private static void assertInvalid(final ExtractRequest.Builder builder) {
    try {
      builder.build();
      fail("Expected IllegalArgumentException");
    } catch (IllegalArgumentException e) { }
  }
}
