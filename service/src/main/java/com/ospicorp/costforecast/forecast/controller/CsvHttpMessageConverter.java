package com.ospicorp.costforecast.forecast.controller;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes a collection of row maps as CSV with a header line. Columns follow the key order of the
 * rows; {@code null} values become empty cells.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Collection<?>> {

  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(TEXT_CSV);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return Collection.class.isAssignableFrom(clazz);
  }

  @Override
  public boolean canRead(@NonNull Class<?> clazz, MediaType mediaType) {
    return false;
  }

  @Override
  @NonNull
  protected Collection<?> readInternal(@NonNull Class<? extends Collection<?>> clazz,
      @NonNull HttpInputMessage inputMessage) throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV request bodies are read as text", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Collection<?> rows,
      @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    write(mapper, rows, outputMessage.getBody());
  }

  /** Writes {@code rows} to {@code out}, leaving the stream open. */
  public static void write(CsvMapper mapper, Collection<?> rows, OutputStream out)
      throws IOException {
    CsvSchema schema = schemaFor(rows);
    if (schema == null) {
      return;
    }
    try (SequenceWriter writer = mapper.writer(schema)
        .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
        .writeValues(out)) {
      for (Object row : rows) {
        writer.write(row);
      }
    }
  }

  private static CsvSchema schemaFor(Collection<?> rows) {
    Set<String> columns = new LinkedHashSet<>();
    for (Object row : rows) {
      if (row instanceof Map<?, ?> map) {
        for (Object key : map.keySet()) {
          if (key != null) {
            columns.add(key.toString());
          }
        }
      } else if (row != null) {
        throw new HttpMessageNotWritableException("CSV rendering expects row maps, got "
            + row.getClass().getSimpleName());
      }
    }
    if (columns.isEmpty()) {
      return null;
    }
    CsvSchema.Builder builder = CsvSchema.builder();
    columns.forEach(builder::addColumn);
    return builder.setUseHeader(true).build();
  }
}
