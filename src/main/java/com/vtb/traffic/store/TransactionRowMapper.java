package com.vtb.traffic.store;

import com.vtb.traffic.models.Transaction;

import java.sql.ResultSet;
import java.sql.SQLException;

final class TransactionRowMapper {

    static final String SELECT_COLUMNS = String.join(", ", SchemaManager.COLUMNS);

    private TransactionRowMapper() {
    }

    static Transaction map(ResultSet rs) throws SQLException {
        long id = rs.getLong("id");
        int status = rs.getInt("response_status");
        Integer responseStatus = rs.wasNull() ? null : status;

        return Transaction.builder()
            .id(id)
            .timestamp(rs.getDouble("timestamp"))
            .method(rs.getString("method"))
            .url(rs.getString("url"))
            .host(rs.getString("host"))
            .path(rs.getString("path"))
            .protocol(rs.getString("protocol"))
            .requestHeaders(HeaderCodec.decode(rs.getString("request_headers"), id))
            .requestBody(rs.getString("request_body"))
            .requestBodyTruncated(rs.getInt("request_body_truncated") != 0)
            .responseStatus(responseStatus)
            .responseHeaders(HeaderCodec.decode(rs.getString("response_headers"), id))
            .responseBody(rs.getString("response_body"))
            .responseBodyTruncated(rs.getInt("response_body_truncated") != 0)
            .duration(rs.getDouble("duration"))
            .analyzed(rs.getInt("analyzed") != 0)
            .notes(rs.getString("notes"))
            .build();
    }
}
