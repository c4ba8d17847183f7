/* 
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of CurveFit
 *
 * CurveFit is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * CurveFit is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with CurveFit.  If not, see <http://www.gnu.org/licenses/>.
 */
package curvefit.output;

import curvefit.processing.fit.FitResult;
import curvefit.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Table of fitted parameters: one row per fit, with the dataset name, the value and error of each parameter, chi² and R².
 * @author Jean Ollion
 */
public class ParameterTable {
    final String name;
    final String[] parameterNames;
    final List<String> columns;
    final List<Object[]> rows = new ArrayList<>();

    public ParameterTable(String name, String[] parameterNames) {
        this.name = name;
        this.parameterNames = parameterNames.clone();
        List<String> cols = new ArrayList<>();
        cols.add("Dataset");
        for (String p : parameterNames) {
            cols.add(p);
            cols.add(p+" Error");
        }
        cols.add("Chi^2");
        cols.add("R^2");
        this.columns = Collections.unmodifiableList(cols);
    }

    public String getName() {
        return name;
    }

    public List<String> getColumns() {
        return columns;
    }

    /**
     * @return whether rows of {@param result} fit in this table
     */
    public boolean accepts(FitResult result) {
        return Arrays.equals(parameterNames, result.getParameterNames());
    }

    public synchronized ParameterTable addRow(FitResult result) {
        if (!accepts(result)) throw new IllegalArgumentException("Parameters of "+result.getModelName()+" do not match table "+name);
        Object[] row = new Object[columns.size()];
        int col = 0;
        row[col++] = result.getDatasetName();
        double[] values = result.getParameters(), errors = result.getErrors();
        for (int i = 0; i<values.length; ++i) {
            row[col++] = values[i];
            row[col++] = errors[i];
        }
        row[col++] = result.getChiSquared();
        row[col] = result.getRSquared();
        rows.add(row);
        return this;
    }

    public synchronized int getRowCount() {
        return rows.size();
    }

    public synchronized Object[] getRow(int row) {
        return rows.get(row).clone();
    }

    public synchronized double getValue(int row, String column) {
        int col = columns.indexOf(column);
        if (col<1) throw new IllegalArgumentException("No numeric column: "+column);
        return (Double)rows.get(row)[col];
    }

    /**
     * @return tab-separated representation, numbers formatted with {@param significantDigits} significant digits
     */
    public synchronized String toText(int significantDigits) {
        StringBuilder sb = new StringBuilder(String.join("\t", columns));
        for (Object[] row : rows) {
            sb.append('\n');
            for (int c = 0; c<row.length; ++c) {
                if (c>0) sb.append('\t');
                sb.append(row[c] instanceof Double ? Utils.format((Double)row[c], significantDigits) : String.valueOf(row[c]));
            }
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ParameterTable: "+name+" ("+getRowCount()+" rows)";
    }
}
