package infra.output;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import domain.conditional.CfRuleType;
import domain.model.Cell;
import domain.model.CellType;
import domain.model.Hyperlink;
import domain.model.RangeRef;
import domain.model.Sheet;
import domain.model.SheetState;
import domain.model.Style;
import domain.model.Workbook;
import domain.output.WorkbookExporter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Locale;

/**
 * JSON dump of the whole model with Jackson.
 *
 * <p>Null and empty values are omitted. Cells use the short keys {@code t}/{@code v}/{@code s}
 * with the type written as its tag ({@code n}, {@code s}, ...); ranges are written in A1
 * notation.</p>
 */
public final class JsonWorkbookExporter implements WorkbookExporter {

    private final ObjectMapper mapper;

    public JsonWorkbookExporter(boolean pretty) {
        this.mapper = createMapper(pretty);
    }

    static ObjectMapper createMapper(boolean pretty) {
        SimpleModule module = new SimpleModule("xlview");
        module.addSerializer(CellType.class, new JsonSerializer<>() {
            @Override
            public void serialize(CellType value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.writeString(value.getTag());
            }
        });
        module.addSerializer(CfRuleType.class, new JsonSerializer<>() {
            @Override
            public void serialize(CfRuleType value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.writeString(value == CfRuleType.OTHER ? "other" : value.getXmlName());
            }
        });
        module.addSerializer(SheetState.class, new JsonSerializer<>() {
            @Override
            public void serialize(SheetState value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
                gen.writeString(value.name().toLowerCase(Locale.ROOT));
            }
        });
        module.addSerializer(RangeRef.class, ToStringSerializer.instance);

        ObjectMapper m = new ObjectMapper()
                .registerModule(module)
                .setSerializationInclusion(JsonInclude.Include.NON_EMPTY)
                .addMixIn(Sheet.class, SheetMixin.class)
                .addMixIn(Cell.class, CellMixin.class)
                .addMixIn(Style.class, StyleMixin.class)
                .addMixIn(Hyperlink.class, HyperlinkMixin.class)
                .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
        if (pretty) m.enable(SerializationFeature.INDENT_OUTPUT);
        return m;
    }

    @Override
    public void write(Workbook workbook, Writer out) {
        try {
            mapper.writeValue(out, workbook);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON", e);
        }
    }

    public String toJson(Workbook workbook) {
        try {
            return mapper.writeValueAsString(workbook);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write JSON", e);
        }
    }

    abstract static class SheetMixin {
        @JsonIgnore
        abstract String getPartPath();
    }

    abstract static class CellMixin {
        @JsonProperty("t")
        abstract CellType getType();

        @JsonProperty("v")
        abstract String getValue();

        @JsonProperty("s")
        abstract Style getStyle();

        @JsonProperty("isDate")
        @JsonInclude(JsonInclude.Include.NON_DEFAULT)
        abstract boolean isDate();

        @JsonProperty("hasComment")
        @JsonInclude(JsonInclude.Include.NON_DEFAULT)
        abstract boolean isHasComment();
    }

    abstract static class StyleMixin {
        @JsonInclude(JsonInclude.Include.NON_DEFAULT)
        abstract int getNumFmtId();
    }

    abstract static class HyperlinkMixin {
        @JsonInclude(JsonInclude.Include.NON_DEFAULT)
        abstract boolean isExternal();
    }
}
