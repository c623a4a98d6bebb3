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

/**
 * How the data source weights samples when computing a summary.
 * 
 * @since 1.0
 */
public enum CalculationBasis {
  TIME_WEIGHTED,
  EVENT_WEIGHTED,
  TIME_WEIGHTED_CONTINUOUS,
  TIME_WEIGHTED_DISCRETE,
  EVENT_WEIGHTED_EXCLUDE_MOST_RECENT_EVENT,
  EVENT_WEIGHTED_EXCLUDE_EARLIEST_EVENT,
  EVENT_WEIGHTED_INCLUDE_BOTH_ENDS
}
