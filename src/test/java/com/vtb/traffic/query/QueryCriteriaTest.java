package com.vtb.traffic.query;

import com.vtb.traffic.TestTransactions;
import com.vtb.traffic.errors.InvalidQueryException;
import com.vtb.traffic.models.Transaction;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QueryCriteriaTest {

    @Test
    void suffixMatchIncludesSubdomainsButNotLookalikes() {
        assertTrue(HostMatch.SUFFIX.matches("example.com", "example.com"));
        assertTrue(HostMatch.SUFFIX.matches("api.example.com", "example.com"));
        assertTrue(HostMatch.SUFFIX.matches("API.Example.com", ".example.com"));
        assertFalse(HostMatch.SUFFIX.matches("badexample.com", "example.com"));
        assertFalse(HostMatch.EXACT.matches("api.example.com", "example.com"));
        assertTrue(HostMatch.EXACT.matches("Example.com", "example.com"));
    }

    @Test
    void fromParametersParsesSupportedCriteria() {
        Map<String, String> parameters = new LinkedHashMap<>();
        parameters.put("method", "post");
        parameters.put("host", "example.com");
        parameters.put("host_match", "exact");
        parameters.put("status", "201");
        parameters.put("since", "10.5");

        QueryCriteria criteria = QueryCriteria.fromParameters(parameters);
        assertEquals("post", criteria.getMethod());
        assertEquals(HostMatch.EXACT, criteria.getHostMatch());
        assertEquals(201, criteria.getStatusCode());
        assertEquals(10.5, criteria.getSince());
    }

    @Test
    void unknownOrInconsistentParametersAreRejected() {
        assertThrows(InvalidQueryException.class, () -> QueryCriteria.fromParameters(Map.of("colour", "red")));
        assertThrows(InvalidQueryException.class, () -> QueryCriteria.fromParameters(Map.of("host_match", "exact")));
        assertThrows(InvalidQueryException.class, () -> QueryCriteria.fromParameters(Map.of("status", "abc")));
        assertThrows(InvalidQueryException.class, () -> QueryCriteria.fromParameters(Map.of("text", "")));
        assertThrows(InvalidQueryException.class,
            () -> QueryCriteria.fromParameters(Map.of("host", "a.example", "host_match", "fuzzy")));
        assertThrows(InvalidQueryException.class,
            () -> QueryCriteria.builder().since(20.0).until(10.0).build().validate());
        assertThrows(InvalidQueryException.class,
            () -> QueryCriteria.builder().protocol("ftp").build().validate());
    }

    @Test
    void matchesCombinesCriteriaWithAnd() {
        Transaction get = TestTransactions.cleanGet("api.example.com", "/orders").build();
        Transaction post = TestTransactions.request("POST", "http://api.example.com/orders")
            .requestBody("{\"item\":\"Widget\"}").build();

        QueryCriteria criteria = QueryCriteria.builder().host("example.com").method("POST").build();
        assertFalse(criteria.matches(get));
        assertTrue(criteria.matches(post));

        QueryCriteria text = QueryCriteria.builder().text("widget").build();
        assertTrue(text.matches(post));
        assertFalse(text.matches(get));

        QueryCriteria scoped = QueryCriteria.all().withScope(HostScope.of(List.of("other.example")));
        assertFalse(scoped.matches(get));
    }

    @Test
    void scopeNormalizesSuffixes() {
        HostScope scope = HostScope.of(List.of(" .Example.com ", "", "example.com"));
        assertEquals(List.of("example.com"), scope.getSuffixes());
        assertTrue(scope.allows("shop.example.com"));
        assertFalse(scope.allows("example.org"));
        assertFalse(HostScope.of(List.of()).isRestricted());
    }
}
