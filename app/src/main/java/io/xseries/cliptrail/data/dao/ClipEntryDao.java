/*
 * ClipTrail — Clipboard History & Search
 * Copyright (C) 2026 Rafael Xudoynazarov (XCON | RX)
 * SPDX-License-Identifier: GPL-3.0-only
 */
package io.xseries.cliptrail.data.dao;

import io.xseries.cliptrail.data.db.Database;
import io.xseries.cliptrail.data.model.ClipEntry;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

public final class ClipEntryDao {

    private final Database db;

    public ClipEntryDao(Database db) {
        this.db = db;
    }

    public List<ClipEntry> listAll() {
        String sql = """
            SELECT text, captured_at
            FROM clip_history
            ORDER BY position ASC
            """;
        try (Connection c = db.open();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            return map(rs);
        } catch (SQLException e) {
            throw new RuntimeException("listAll failed", e);
        }
    }

    /**
     * Replaces the table content with {@code entries} in one transaction.
     * Position follows list order.
     */
    public void replaceAll(List<ClipEntry> entries) {
        String insert = "INSERT INTO clip_history(position, text, captured_at) VALUES (?, ?, ?)";
        try (Connection c = db.open()) {
            c.setAutoCommit(false);
            try (Statement st = c.createStatement();
                 PreparedStatement ps = c.prepareStatement(insert)) {
                st.executeUpdate("DELETE FROM clip_history");

                int position = 0;
                for (ClipEntry e : entries) {
                    ps.setInt(1, position++);
                    ps.setString(2, e.text());
                    ps.setLong(3, e.epochSecond());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new RuntimeException("replaceAll failed", e);
        }
    }

    private List<ClipEntry> map(ResultSet rs) throws SQLException {
        List<ClipEntry> list = new ArrayList<>();
        while (rs.next()) {
            String text = rs.getString("text");
            long capturedAt = rs.getLong("captured_at");
            if (text == null || text.isEmpty()) continue;
            list.add(ClipEntry.ofEpochSecond(text, capturedAt));
        }
        return list;
    }
}
