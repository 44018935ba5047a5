package io.netstab.engine.simulation;

/*
 * Copyright (c) netstab
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
import org.apache.commons.math3.stat.descriptive.StatisticalSummary;
import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.ToDoubleFunction;
import java.util.stream.Stream;

/// Ordered, immutable rows of a simulation run; row `i` is trial `i`.
///
/// ## Columns
///
/// | Column | Name | Range |
/// |--------|------|-------|
/// | [Column#PLANTS] | plants | ≥ 1 |
/// | [Column#ANIMALS] | animals | ≥ 1 |
/// | [Column#DRAWN_CONNECTANCE] | drawn_connectance | [0,1] |
/// | [Column#DIVERSITY] | diversity | plants + animals |
/// | [Column#CONNECTANCE] | connectance | [0,1] |
/// | [Column#NESTEDNESS] | nestedness | [0,100] or NaN |
/// | [Column#MODULARITY] | modularity | [0,1] or NaN |
/// | [Column#RESILIENCE_MUTUALISM] | resilience_mutualism | real or NaN |
/// | [Column#RESILIENCE_ANTAGONISM] | resilience_antagonism | real or NaN |
public final class ResultsTable implements Iterable<SimulationTrial> {

    public enum Column {
        PLANTS("plants", SimulationTrial::plants),
        ANIMALS("animals", SimulationTrial::animals),
        DRAWN_CONNECTANCE("drawn_connectance", SimulationTrial::drawnConnectance),
        DIVERSITY("diversity", SimulationTrial::diversity),
        CONNECTANCE("connectance", SimulationTrial::connectance),
        NESTEDNESS("nestedness", SimulationTrial::nestedness),
        MODULARITY("modularity", SimulationTrial::modularity),
        RESILIENCE_MUTUALISM("resilience_mutualism", SimulationTrial::resilienceMutualism),
        RESILIENCE_ANTAGONISM("resilience_antagonism", SimulationTrial::resilienceAntagonism);

        private final String columnName;
        private final ToDoubleFunction<SimulationTrial> accessor;

        Column(String columnName, ToDoubleFunction<SimulationTrial> accessor) {
            this.columnName = columnName;
            this.accessor = accessor;
        }

        public String columnName() {
            return columnName;
        }

        public double valueOf(SimulationTrial trial) {
            return accessor.applyAsDouble(trial);
        }
    }

    private final List<SimulationTrial> rows;

    public ResultsTable(List<SimulationTrial> rows) {
        Objects.requireNonNull(rows, "rows cannot be null");
        this.rows = List.copyOf(rows);
    }

    public List<SimulationTrial> rows() {
        return rows;
    }

    public SimulationTrial get(int index) {
        return rows.get(index);
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public Stream<SimulationTrial> stream() {
        return rows.stream();
    }

    @Override
    public Iterator<SimulationTrial> iterator() {
        return rows.iterator();
    }

    /// All values of one column in trial order, NaN included.
    public double[] column(Column column) {
        double[] values = new double[rows.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = column.valueOf(rows.get(i));
        }
        return values;
    }

    /// Descriptive statistics of one column over its defined (non-NaN) values.
    public StatisticalSummary summary(Column column) {
        SummaryStatistics stats = new SummaryStatistics();
        for (SimulationTrial row : rows) {
            double value = column.valueOf(row);
            if (!Double.isNaN(value)) {
                stats.addValue(value);
            }
        }
        return stats.getSummary();
    }

    public Map<TrialStatus, Long> countByStatus() {
        Map<TrialStatus, Long> counts = new EnumMap<>(TrialStatus.class);
        for (TrialStatus status : TrialStatus.values()) {
            counts.put(status, 0L);
        }
        for (SimulationTrial row : rows) {
            counts.merge(row.status(), 1L, Long::sum);
        }
        return counts;
    }

    /// Rows with the given status, in trial order.
    public List<SimulationTrial> withStatus(TrialStatus status) {
        List<SimulationTrial> matching = new ArrayList<>();
        for (SimulationTrial row : rows) {
            if (row.status() == status) {
                matching.add(row);
            }
        }
        return matching;
    }

    @Override
    public String toString() {
        return "ResultsTable{rows=" + rows.size() + ", status=" + countByStatus() + "}";
    }
}
