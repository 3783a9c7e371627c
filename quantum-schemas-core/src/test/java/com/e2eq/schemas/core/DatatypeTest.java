package com.e2eq.schemas.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DatatypeTest {

    @Test
    void testLabelsAndNamesResolve() {
        assertEquals(Datatype.TELEPHONE_NUMBER, Datatype.fromLabel("Telephone number"));
        assertEquals(Datatype.TELEPHONE_NUMBER, Datatype.fromLabel("telephone_number"));
        assertEquals(Datatype.URL, Datatype.fromLabel(" url "));
        assertEquals(Datatype.GEOGRAPHIC_COORDINATE, Datatype.fromLabel("Geographic coordinate"));
    }

    @Test
    void testUnknownFallsBackToPage() {
        assertEquals(Datatype.PAGE, Datatype.fromLabel(null));
        assertEquals(Datatype.PAGE, Datatype.fromLabel(""));
        assertEquals(Datatype.PAGE, Datatype.fromLabel("Monetary"));
    }

    @Test
    void testStoreLookupMissIsPage() {
        SchemaStore store = SchemaFixtures.builder().build();
        assertEquals(Datatype.PAGE, store.datatypeOf("Has nothing"));
        assertFalse(store.isMultiValue("Has nothing"));
    }
}
