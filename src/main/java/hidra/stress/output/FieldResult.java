package hidra.stress.output;

import hidra.stress.StressFacade;
import hidra.stress.fields.ScalarFieldSample;
import hidra.stress.fields.StressField;
import hidra.stress.utils.NumericUtils;
import java.text.DecimalFormat;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Forms an easy interface by which external programs (exporters to tables or visualization
 * formats) can read the fields produced by a stress reduction. FieldResult holds a map from
 * string descriptors to arrays of doubles, one entry per point for field data, or a single entry
 * for constants such as the elastic moduli, and a map of text descriptors such as the stress type.
 * Keys keep insertion order so that columns come out in a stable order.
 */
public class FieldResult {

  /**
   * Get the data of a single field: its coordinates, values and errors
   *
   * @param field field to export
   * @return object holding keys vx, vy, vz, (name)_values and (name)_errors
   */
  public static FieldResult buildFieldData(ScalarFieldSample field) {
    FieldResult out = new FieldResult();
    out.putCoordinates("", field);
    out.putField(field.getName(), field);
    out.textMap.put("Name", field.getName());
    return out;
  }

  /**
   * Get all the data exposed by a stress facade: coordinates of the common support, strain and
   * stress of each direction, and the consensus reference spacing (on its own points)
   *
   * @param facade facade over a calculated stress field
   * @return object holding these values in easily-accessed maps with variable descriptions
   */
  public static FieldResult buildStressData(StressFacade facade) {
    FieldResult out = new FieldResult();
    StressField stressField = facade.getStressField();
    out.numerMap.put("vx", facade.getX());
    out.numerMap.put("vy", facade.getY());
    out.numerMap.put("vz", facade.getZ());
    for (String direction : StressField.DIRECTIONS) {
      out.putField("strain" + direction, stressField.getStrain(direction));
    }
    for (String direction : StressField.DIRECTIONS) {
      out.putField("stress" + direction, stressField.getStress(direction));
    }
    ScalarFieldSample dReference = facade.getDReference();
    out.putCoordinates("d_reference_", dReference);
    out.putField("d_reference", dReference);

    out.numerMap.put("Youngs_modulus", new double[]{facade.getYoungsModulus()});
    out.numerMap.put("Poisson_ratio", new double[]{facade.getPoissonRatio()});
    out.textMap.put("Stress_type", facade.getStressType().getName());
    for (String direction : StressField.DIRECTIONS) {
      out.textMap.put("Runs_" + direction, String.join(",", facade.runs(direction)));
    }
    return out;
  }

  Map<String, double[]> numerMap;
  Map<String, String> textMap;

  private FieldResult() {
    numerMap = new LinkedHashMap<>();
    textMap = new LinkedHashMap<>();
  }

  private void putCoordinates(String prefix, ScalarFieldSample field) {
    numerMap.put(prefix + "vx", field.getX());
    numerMap.put(prefix + "vy", field.getY());
    numerMap.put(prefix + "vz", field.getZ());
  }

  private void putField(String key, ScalarFieldSample field) {
    numerMap.put(key + "_values", field.getValues());
    numerMap.put(key + "_errors", field.getErrors());
  }

  /**
   * Return the map of numeric data
   * @return map of double arrays keyed by strings describing the data
   * (i.e., vx, stress11_values, Youngs_modulus)
   */
  public Map<String, double[]> getNumerMap() {
    return numerMap;
  }

  /**
   * Return the map of text data
   * @return map of strings keyed by descriptions (i.e., Stress_type)
   */
  public Map<String, String> getTextMap() {
    return textMap;
  }

  /**
   * Human-readable summary: the text entries, constants and the number of points of each array
   * @return multi-line report string
   */
  public String getReportString() {
    DecimalFormat format = NumericUtils.DECIMAL_FORMAT.get();
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> entry : textMap.entrySet()) {
      sb.append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
    }
    for (Map.Entry<String, double[]> entry : numerMap.entrySet()) {
      double[] data = entry.getValue();
      sb.append(entry.getKey()).append(": ");
      if (data.length == 1) {
        sb.append(format.format(data[0]));
      } else {
        sb.append(data.length).append(" points");
      }
      sb.append('\n');
    }
    return sb.toString();
  }
}
