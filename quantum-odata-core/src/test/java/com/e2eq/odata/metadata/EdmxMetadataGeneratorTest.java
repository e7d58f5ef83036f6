package com.e2eq.odata.metadata;

import com.e2eq.odata.SampleCatalog;
import com.e2eq.odata.memory.InMemoryMetadataRegistry;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EdmxMetadataGeneratorTest {

    @Test
    void testDocumentStructure() throws Exception {
        String xml = new EdmxMetadataGenerator(SampleCatalog.registry()).render("QuantumOData");
        Document doc = parse(xml);

        Element root = doc.getDocumentElement();
        assertEquals("Edmx", root.getLocalName());
        assertEquals(EdmxMetadataGenerator.EDMX_NS, root.getNamespaceURI());
        assertEquals("4.0", root.getAttribute("Version"));

        Element schema = (Element) doc.getElementsByTagNameNS(EdmxMetadataGenerator.EDM_NS, "Schema").item(0);
        assertEquals("QuantumOData", schema.getAttribute("Namespace"));

        NodeList entityTypes = doc.getElementsByTagNameNS(EdmxMetadataGenerator.EDM_NS, "EntityType");
        assertEquals(4, entityTypes.getLength());

        Element container = (Element) doc.getElementsByTagNameNS(EdmxMetadataGenerator.EDM_NS, "EntityContainer").item(0);
        assertEquals("Container", container.getAttribute("Name"));
        NodeList sets = container.getElementsByTagNameNS(EdmxMetadataGenerator.EDM_NS, "EntitySet");
        assertEquals(4, sets.getLength());
        Element orders = (Element) sets.item(2);
        assertEquals("Orders", orders.getAttribute("Name"));
        assertEquals("QuantumOData.Orders", orders.getAttribute("EntityType"));
    }

    @Test
    void testEntityTypeKeyAndProperties() throws Exception {
        Document doc = parse(new EdmxMetadataGenerator(SampleCatalog.registry()).render("NS"));
        Element orders = entityType(doc, "Orders");

        Element ref = (Element) orders.getElementsByTagNameNS(EdmxMetadataGenerator.EDM_NS, "PropertyRef").item(0);
        assertEquals("id", ref.getAttribute("Name"));

        NodeList properties = orders.getElementsByTagNameNS(EdmxMetadataGenerator.EDM_NS, "Property");
        assertEquals(5, properties.getLength());
        Element id = (Element) properties.item(0);
        assertEquals("id", id.getAttribute("Name"));
        assertEquals("Edm.String", id.getAttribute("Type"));
        assertEquals("false", id.getAttribute("Nullable"));

        Element amount = property(orders, "amount");
        assertEquals("Edm.Double", amount.getAttribute("Type"));
        assertEquals("true", amount.getAttribute("Nullable"));
        assertEquals("Edm.String", property(orders, "customer").getAttribute("Type"));
    }

    @Test
    void testNamesAreEscaped() throws Exception {
        InMemoryMetadataRegistry registry = new InMemoryMetadataRegistry()
                .register(SampleCatalog.object("R&D").addField(SampleCatalog.field("a<b", "text")));
        String xml = new EdmxMetadataGenerator(registry).render("Ns\"x");

        assertTrue(xml.contains("R&amp;D"));
        assertTrue(xml.contains("a&lt;b"));
        Document doc = parse(xml);
        assertEquals("R&D", entityType(doc, "R&D").getAttribute("Name"));
    }

    @Test
    void testTypeMapping() {
        for (String type : List.of("text", "textarea", "markdown", "html", "email", "url", "phone", "password",
                "select", "lookup", "master_detail", "file", "image", "object", "formula", "summary")) {
            assertEquals("Edm.String", EdmTypeMapper.toEdmType(type), type);
        }
        assertEquals("Edm.Double", EdmTypeMapper.toEdmType("number"));
        assertEquals("Edm.Double", EdmTypeMapper.toEdmType("currency"));
        assertEquals("Edm.Double", EdmTypeMapper.toEdmType("percent"));
        assertEquals("Edm.Int32", EdmTypeMapper.toEdmType("autonumber"));
        assertEquals("Edm.Boolean", EdmTypeMapper.toEdmType("boolean"));
        assertEquals("Edm.Date", EdmTypeMapper.toEdmType("date"));
        assertEquals("Edm.DateTimeOffset", EdmTypeMapper.toEdmType("datetime"));
        assertEquals("Edm.TimeOfDay", EdmTypeMapper.toEdmType("time"));
        assertEquals("Edm.String", EdmTypeMapper.toEdmType("geolocation"));
        assertEquals("Edm.String", EdmTypeMapper.toEdmType(null));
    }

    @Test
    void testServiceDocument() {
        ServiceDocument doc = ServiceDocument.of("/odata", List.of("Orders"));
        assertEquals("/odata/$metadata", doc.context());
        assertEquals(List.of(new ServiceDocument.Entry("Orders", "EntitySet", "Orders")), doc.value());
    }

    private static Element entityType(Document doc, String name) {
        NodeList types = doc.getElementsByTagNameNS(EdmxMetadataGenerator.EDM_NS, "EntityType");
        for (int i = 0; i < types.getLength(); i++) {
            Element type = (Element) types.item(i);
            if (name.equals(type.getAttribute("Name"))) {
                return type;
            }
        }
        throw new AssertionError("No EntityType " + name);
    }

    private static Element property(Element entityType, String name) {
        NodeList properties = entityType.getElementsByTagNameNS(EdmxMetadataGenerator.EDM_NS, "Property");
        for (int i = 0; i < properties.getLength(); i++) {
            Element property = (Element) properties.item(i);
            if (name.equals(property.getAttribute("Name"))) {
                return property;
            }
        }
        throw new AssertionError("No Property " + name);
    }

    private static Document parse(String xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)));
    }
}
