package cafe.woden.cui.config;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.deser.DeserializationProblemHandler;
import com.fasterxml.jackson.databind.deser.ValueInstantiator;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import java.io.IOException;

/**
 * Jackson setup for the settings file.
 *
 * <p>Typed views are read leniently: a value of the wrong type for a known field becomes
 * {@code null} in the view instead of failing the read, and so does a number outside the field's
 * range. The stored document keeps the raw value. Text after the top-level value is an error.
 */
final class SettingsJson {

  static final ObjectMapper MAPPER =
      JsonMapper.builder()
          .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
          .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
          .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
          .addHandler(new NullOnMismatch())
          .addModule(
              new SimpleModule("cui-lenient-numbers")
                  .addDeserializer(Integer.class, new LenientIntegerDeserializer())
                  .addDeserializer(Long.class, new LenientLongDeserializer()))
          .build();

  static final ObjectWriter PRETTY = MAPPER.writerWithDefaultPrettyPrinter();

  private SettingsJson() {}

  private static final class NullOnMismatch extends DeserializationProblemHandler {

    @Override
    public Object handleWeirdStringValue(
        DeserializationContext ctxt, Class<?> targetType, String valueToConvert, String failureMsg) {
      return null;
    }

    @Override
    public Object handleWeirdNumberValue(
        DeserializationContext ctxt, Class<?> targetType, Number valueToConvert, String failureMsg) {
      return null;
    }

    @Override
    public Object handleUnexpectedToken(
        DeserializationContext ctxt,
        JavaType targetType,
        JsonToken t,
        JsonParser p,
        String failureMsg)
        throws IOException {
      p.skipChildren();
      return null;
    }

    @Override
    public Object handleMissingInstantiator(
        DeserializationContext ctxt,
        Class<?> instClass,
        ValueInstantiator valueInsta,
        JsonParser p,
        String msg)
        throws IOException {
      p.skipChildren();
      return null;
    }
  }

  /** Whole numbers within the field's range. Overflow, fractions and other text read as null. */
  private abstract static class LenientWholeNumberDeserializer<T extends Number>
      extends StdDeserializer<T> {

    private final double min;
    private final double maxExclusive;

    LenientWholeNumberDeserializer(Class<T> type, double min, double maxExclusive) {
      super(type);
      this.min = min;
      this.maxExclusive = maxExclusive;
    }

    abstract T fromDouble(double value);

    abstract T fromLong(long value);

    @Override
    public T deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
      JsonToken t = p.currentToken();
      if (t == JsonToken.VALUE_NUMBER_INT) {
        if (p.getNumberType() == JsonParser.NumberType.BIG_INTEGER) return null;
        long v = p.getLongValue();
        return v >= min && v < maxExclusive ? fromLong(v) : null;
      }
      if (t == JsonToken.VALUE_NUMBER_FLOAT) {
        return inRange(p.getDoubleValue());
      }
      if (t == JsonToken.VALUE_STRING) {
        try {
          return inRange(Double.parseDouble(p.getText().trim()));
        } catch (NumberFormatException e) {
          return null;
        }
      }
      p.skipChildren();
      return null;
    }

    private T inRange(double d) {
      if (Double.isNaN(d) || d != Math.rint(d) || d < min || d >= maxExclusive) return null;
      return fromDouble(d);
    }
  }

  private static final class LenientIntegerDeserializer
      extends LenientWholeNumberDeserializer<Integer> {

    LenientIntegerDeserializer() {
      super(Integer.class, Integer.MIN_VALUE, 0x1p31);
    }

    @Override
    Integer fromDouble(double value) {
      return (int) value;
    }

    @Override
    Integer fromLong(long value) {
      return (int) value;
    }
  }

  private static final class LenientLongDeserializer extends LenientWholeNumberDeserializer<Long> {

    LenientLongDeserializer() {
      super(Long.class, Long.MIN_VALUE, 0x1p63);
    }

    @Override
    Long fromDouble(double value) {
      return (long) value;
    }

    @Override
    Long fromLong(long value) {
      return value;
    }
  }
}
