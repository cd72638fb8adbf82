package hidra.stress.output;

import hidra.stress.fields.ScalarFieldSample;
import java.util.HashSet;
import java.util.Set;
import org.jfree.data.xy.XYSeries;
import org.jfree.data.xy.XYSeriesCollection;
import org.jfree.data.xy.YIntervalSeries;
import org.jfree.data.xy.YIntervalSeriesCollection;

/**
 * Turns fields into chart data series against one of the sample coordinates, for consumers that
 * plot profiles of strain or stress along a scan line. Points with a NaN value are left out.
 */
public class FieldPlotter {

  /**
   * Sample coordinate to use as the x-axis of the plot
   */
  public enum Axis {
    VX, VY, VZ;

    double[] coordinatesOf(ScalarFieldSample field) {
      switch (this) {
        case VX:
          return field.getX();
        case VY:
          return field.getY();
        default:
          return field.getZ();
      }
    }
  }

  /**
   * Add the values of each field to a series collection, one series per field
   *
   * @param axis coordinate giving the x-value of each point
   * @param fields fields to plot; fields sharing a name get their position appended to the key
   * @return plottable data
   */
  public static XYSeriesCollection toSeriesCollection(Axis axis, ScalarFieldSample... fields) {
    XYSeriesCollection xysc = new XYSeriesCollection();
    Set<String> used = new HashSet<>();
    for (int i = 0; i < fields.length; ++i) {
      ScalarFieldSample field = fields[i];
      XYSeries series = new XYSeries(seriesKey(field, i, used), true, true);
      double[] x = axis.coordinatesOf(field);
      double[] values = field.getValues();
      for (int j = 0; j < values.length; ++j) {
        if (Double.isNaN(values[j])) {
          continue;
        }
        series.add(x[j], values[j]);
      }
      xysc.addSeries(series);
    }
    return xysc;
  }

  /**
   * Add the values of each field with their error bars (value +/- error) to a series collection
   *
   * @param axis coordinate giving the x-value of each point
   * @param fields fields to plot
   * @return plottable data with y-intervals
   */
  public static YIntervalSeriesCollection toIntervalCollection(Axis axis,
      ScalarFieldSample... fields) {
    YIntervalSeriesCollection collection = new YIntervalSeriesCollection();
    Set<String> used = new HashSet<>();
    for (int i = 0; i < fields.length; ++i) {
      ScalarFieldSample field = fields[i];
      YIntervalSeries series = new YIntervalSeries(seriesKey(field, i, used), true, true);
      double[] x = axis.coordinatesOf(field);
      double[] values = field.getValues();
      double[] errors = field.getErrors();
      for (int j = 0; j < values.length; ++j) {
        if (Double.isNaN(values[j])) {
          continue;
        }
        double error = Double.isNaN(errors[j]) ? 0. : errors[j];
        series.add(x[j], values[j], values[j] - error, values[j] + error);
      }
      collection.addSeries(series);
    }
    return collection;
  }

  private static String seriesKey(ScalarFieldSample field, int index, Set<String> used) {
    String key = field.getName();
    if (!used.add(key)) {
      key = key + " [" + index + "]";
      used.add(key);
    }
    return key;
  }
}
