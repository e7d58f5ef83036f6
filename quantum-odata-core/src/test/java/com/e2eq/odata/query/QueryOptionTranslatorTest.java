package com.e2eq.odata.query;

import com.e2eq.odata.error.ODataErrorCode;
import com.e2eq.odata.error.ODataException;
import com.e2eq.odata.query.filter.ComparisonOperator;
import com.e2eq.odata.query.filter.FilterNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryOptionTranslatorTest {

    private final QueryOptionTranslator translator = new QueryOptionTranslator(true);

    @Test
    void testParseQueryString() {
        Map<String, String> options = QueryOptionsParser.parse(
                "$filter=name%20eq%20'a%3Db'&$top=5&$search=big+red&$select=");
        assertEquals("name eq 'a=b'", options.get("$filter"));
        assertEquals("5", options.get("$top"));
        assertEquals("big red", options.get("$search"));
        assertEquals("", options.get("$select"));
    }

    @Test
    void testValueKeepsEverythingAfterFirstEquals() {
        Map<String, String> options = QueryOptionsParser.parse("$filter=code eq 'x=y=z'");
        assertEquals("code eq 'x=y=z'", options.get("$filter"));
    }

    @Test
    void testMalformedPercentEncoding() {
        ODataException ex = assertThrows(ODataException.class, () -> QueryOptionsParser.parse("$filter=%zz"));
        assertEquals(ODataErrorCode.INVALID_QUERY, ex.getCode());
    }

    @Test
    void testTranslateAllOptions() {
        QueryDescriptor query = translator.translate(QueryOptionsParser.parse(
                "$filter=price gt 10&$orderby=name desc, price&$top=20&$skip=40&$select=name,,price&$search=widget"));

        assertEquals(new FilterNode.Comparison("price", ComparisonOperator.GT, 10L), query.getFilter());
        assertEquals(List.of(OrderByField.desc("name"), OrderByField.asc("price")), query.getOrderBy());
        assertEquals(20, query.getLimit());
        assertEquals(40, query.getOffset());
        assertEquals(List.of("name", "price"), query.getFields());
        assertEquals("widget", query.getSearch());
    }

    @Test
    void testEmptyOptionsGiveEmptyDescriptor() {
        assertEquals(QueryDescriptor.empty(), translator.translate(Map.of()));
    }

    @Test
    void testBlankOptionValuesAreIgnored() {
        Map<String, String> options = QueryOptionsParser.parse("$filter=&$orderby=&$top=&$skip=%20&$select=");
        assertEquals(QueryDescriptor.empty(), translator.translate(options));
    }

    @Test
    void testSearchIgnoredWhenDisabled() {
        QueryOptionTranslator noSearch = new QueryOptionTranslator(false);
        assertNull(noSearch.translate(Map.of("$search", "widget")).getSearch());
    }

    @Test
    void testInvalidOrderByDirection() {
        ODataException ex = assertThrows(ODataException.class,
                () -> translator.translate(Map.of("$orderby", "name sideways")));
        assertEquals(ODataErrorCode.INVALID_ORDER_BY, ex.getCode());
        assertEquals("$orderby", ex.getTarget());
    }

    @Test
    void testOrderByDirectionIsCaseInsensitive() {
        assertEquals(List.of(OrderByField.desc("name")), QueryOptionTranslator.parseOrderBy("name DESC"));
    }

    @Test
    void testNegativeOrNonNumericPaging() {
        ODataException top = assertThrows(ODataException.class, () -> translator.translate(Map.of("$top", "-1")));
        assertEquals(ODataErrorCode.INVALID_QUERY, top.getCode());
        assertEquals("$top", top.getTarget());

        ODataException skip = assertThrows(ODataException.class, () -> translator.translate(Map.of("$skip", "ten")));
        assertEquals("$skip", skip.getTarget());
    }

    @Test
    void testEmptySelect() {
        ODataException ex = assertThrows(ODataException.class, () -> translator.translate(Map.of("$select", " , ")));
        assertEquals(ODataErrorCode.INVALID_SELECT, ex.getCode());
    }

    @Test
    void testCountDescriptorKeepsFilterAndSearchOnly() {
        QueryDescriptor query = translator.translate(Map.of(
                "$filter", "price gt 10", "$top", "1", "$skip", "2", "$orderby", "name", "$search", "w"));
        QueryDescriptor count = translator.countDescriptor(query);
        assertEquals(query.getFilter(), count.getFilter());
        assertEquals("w", count.getSearch());
        assertNull(count.getLimit());
        assertNull(count.getOffset());
        assertNull(count.getOrderBy());
        assertNull(count.getFields());
    }

    @Test
    void testCountRequested() {
        assertTrue(QueryOptionTranslator.isCountRequested(Map.of("$count", "true")));
        assertTrue(QueryOptionTranslator.isCountRequested(Map.of("$count", "TRUE")));
        assertFalse(QueryOptionTranslator.isCountRequested(Map.of("$count", "false")));
        assertFalse(QueryOptionTranslator.isCountRequested(Map.of("$count", "1")));
        assertFalse(QueryOptionTranslator.isCountRequested(Map.of()));
    }
}
