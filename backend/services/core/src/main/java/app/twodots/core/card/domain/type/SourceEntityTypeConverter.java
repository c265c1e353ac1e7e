package app.twodots.core.card.domain.type;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

// Unknown labels read as null so the card degrades to an orphan instead of failing the row.
@Converter
public class SourceEntityTypeConverter implements AttributeConverter<SourceEntityType, String> {

    private static final Logger log = LoggerFactory.getLogger(SourceEntityTypeConverter.class);

    @Override
    public String convertToDatabaseColumn(SourceEntityType attribute) {
        return attribute == null ? null : attribute.label();
    }

    @Override
    public SourceEntityType convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        return SourceEntityType.fromLabel(dbData).orElseGet(() -> {
            log.warn("Unknown source entity type '{}'", dbData);
            return null;
        });
    }
}
