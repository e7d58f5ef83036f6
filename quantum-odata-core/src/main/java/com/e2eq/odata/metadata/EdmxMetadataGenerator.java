package com.e2eq.odata.metadata;

import com.e2eq.odata.spi.FieldMetadata;
import com.e2eq.odata.spi.MetadataRegistry;
import com.e2eq.odata.spi.ObjectMetadata;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Renders the CSDL ({@code $metadata}) document for every registered object type. Each type
 * becomes an {@code EntityType} keyed on {@code id} and an {@code EntitySet} of the same name in
 * a single {@code Container}.
 */
public class EdmxMetadataGenerator {

    static final String EDMX_NS = "http://docs.oasis-open.org/odata/ns/edmx";
    static final String EDM_NS = "http://docs.oasis-open.org/odata/ns/edm";
    static final String KEY_PROPERTY = "id";
    static final String CONTAINER_NAME = "Container";

    private static final XMLOutputFactory OUTPUT_FACTORY = XMLOutputFactory.newFactory();

    private final MetadataRegistry metadataRegistry;

    public EdmxMetadataGenerator(MetadataRegistry metadataRegistry) {
        this.metadataRegistry = metadataRegistry;
    }

    public String render(String namespace) {
        List<String> types = metadataRegistry.listObjectTypes();
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter xml = OUTPUT_FACTORY.createXMLStreamWriter(out);
            xml.writeStartDocument("UTF-8", "1.0");
            xml.writeStartElement("edmx", "Edmx", EDMX_NS);
            xml.writeNamespace("edmx", EDMX_NS);
            xml.writeAttribute("Version", "4.0");
            xml.writeStartElement("edmx", "DataServices", EDMX_NS);
            xml.writeStartElement("Schema");
            xml.writeDefaultNamespace(EDM_NS);
            xml.writeAttribute("Namespace", namespace);

            for (String type : types) {
                writeEntityType(xml, type, metadataRegistry.getObjectMetadata(type));
            }

            xml.writeStartElement("EntityContainer");
            xml.writeAttribute("Name", CONTAINER_NAME);
            for (String type : types) {
                xml.writeEmptyElement("EntitySet");
                xml.writeAttribute("Name", type);
                xml.writeAttribute("EntityType", namespace + "." + type);
            }
            xml.writeEndElement(); // EntityContainer

            xml.writeEndElement(); // Schema
            xml.writeEndElement(); // DataServices
            xml.writeEndElement(); // Edmx
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to render $metadata document", e);
        }
        return out.toString();
    }

    private void writeEntityType(XMLStreamWriter xml, String type, Optional<ObjectMetadata> metadata)
            throws XMLStreamException {
        xml.writeStartElement("EntityType");
        xml.writeAttribute("Name", type);

        xml.writeStartElement("Key");
        xml.writeEmptyElement("PropertyRef");
        xml.writeAttribute("Name", KEY_PROPERTY);
        xml.writeEndElement();

        xml.writeEmptyElement("Property");
        xml.writeAttribute("Name", KEY_PROPERTY);
        xml.writeAttribute("Type", EdmTypeMapper.EDM_STRING);
        xml.writeAttribute("Nullable", "false");

        if (metadata.isPresent() && metadata.get().getFields() != null) {
            for (Map.Entry<String, FieldMetadata> entry : metadata.get().getFields().entrySet()) {
                if (KEY_PROPERTY.equals(entry.getKey())) {
                    continue;
                }
                FieldMetadata field = entry.getValue();
                xml.writeEmptyElement("Property");
                xml.writeAttribute("Name", entry.getKey());
                xml.writeAttribute("Type", EdmTypeMapper.toEdmType(field == null ? null : field.getType()));
                xml.writeAttribute("Nullable", "true");
            }
        }
        xml.writeEndElement(); // EntityType
    }
}
