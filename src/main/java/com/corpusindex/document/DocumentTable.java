package com.corpusindex.document;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 文档目录表：记录每个枚举文档的 ID、路径与本次运行结果，用于把倒排中的文档 ID 还原为路径。
 */
public final class DocumentTable implements AutoCloseable {
    private static final String CREATE_TABLE_SQL = """
            CREATE TABLE IF NOT EXISTS documents (
                doc_id      INTEGER PRIMARY KEY,
                path        TEXT NOT NULL,
                size_bytes  INTEGER,
                status      TEXT NOT NULL,
                reason      TEXT,
                token_count INTEGER DEFAULT 0
            )
            """;

    private static final String CREATE_IDX_PATH_SQL = "CREATE INDEX IF NOT EXISTS idx_path ON documents(path)";
    private static final String CREATE_IDX_STATUS_SQL = "CREATE INDEX IF NOT EXISTS idx_status ON documents(status)";
    private static final String ENABLE_WAL_SQL = "PRAGMA journal_mode=WAL";
    private static final String SELECT_COLUMNS = "SELECT doc_id, path, size_bytes, status, reason, token_count FROM documents";

    private final Connection connection;

    /**
     * 初始化文档目录表并启用 WAL。
     */
    public DocumentTable(Path dbPath) {
        try {
            this.connection = DriverManager.getConnection("jdbc:sqlite:" + dbPath.toAbsolutePath());
            initializeSchema();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("初始化文档表失败: " + dbPath, sqlException);
        }
    }

    /**
     * 在单个事务内批量写入文档记录，任一失败则整体回滚。
     */
    public void insertAll(List<DocumentRecord> records) {
        String sql = """
                INSERT INTO documents(doc_id, path, size_bytes, status, reason, token_count)
                VALUES (?, ?, ?, ?, ?, ?)
                """;
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            connection.setAutoCommit(false);
            for (DocumentRecord record : records) {
                preparedStatement.setInt(1, record.docId());
                preparedStatement.setString(2, normalizePath(record.path().toString()));
                preparedStatement.setLong(3, record.sizeBytes());
                preparedStatement.setString(4, record.status().name());
                if (record.reason() == null) {
                    preparedStatement.setNull(5, Types.VARCHAR);
                } else {
                    preparedStatement.setString(5, record.reason());
                }
                preparedStatement.setInt(6, record.tokenCount());
                preparedStatement.addBatch();
            }
            preparedStatement.executeBatch();
            connection.commit();
            connection.setAutoCommit(true);
        } catch (SQLException sqlException) {
            rollbackQuietly(sqlException);
            restoreAutoCommitQuietly(sqlException);
            throw new IllegalStateException("批量写入文档失败, count=" + records.size(), sqlException);
        }
    }

    /**
     * 按 ID 查找文档。
     */
    public Optional<DocumentRecord> findById(int docId) {
        String sql = SELECT_COLUMNS + " WHERE doc_id = ?";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setInt(1, docId);
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(readRecord(resultSet));
            }
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按 ID 查询失败, docId=" + docId, sqlException);
        }
    }

    /**
     * 按状态列出文档，按 doc_id 升序。
     */
    public List<DocumentRecord> findByStatus(DocumentStatus status) {
        String sql = SELECT_COLUMNS + " WHERE status = ? ORDER BY doc_id";
        List<DocumentRecord> records = new ArrayList<>();
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql)) {
            preparedStatement.setString(1, status.name());
            try (ResultSet resultSet = preparedStatement.executeQuery()) {
                while (resultSet.next()) {
                    records.add(readRecord(resultSet));
                }
            }
            return records;
        } catch (SQLException sqlException) {
            throw new IllegalStateException("按状态查询失败, status=" + status, sqlException);
        }
    }

    /**
     * 获取文档总数。
     */
    public int getTotalDocCount() {
        String sql = "SELECT COUNT(*) FROM documents";
        try (PreparedStatement preparedStatement = connection.prepareStatement(sql);
             ResultSet resultSet = preparedStatement.executeQuery()) {
            return resultSet.getInt(1);
        } catch (SQLException sqlException) {
            throw new IllegalStateException("查询文档总数失败", sqlException);
        }
    }

    public void clear() {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("DELETE FROM documents");
        } catch (SQLException sqlException) {
            throw new IllegalStateException("清空文档表失败", sqlException);
        }
    }

    /**
     * 关闭数据库连接。
     */
    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException sqlException) {
            throw new IllegalStateException("关闭数据库连接失败", sqlException);
        }
    }

    /**
     * 读取当前连接的 journal_mode。
     */
    String getJournalMode() {
        try (Statement statement = connection.createStatement();
             ResultSet resultSet = statement.executeQuery("PRAGMA journal_mode")) {
            return resultSet.next() ? resultSet.getString(1) : "";
        } catch (SQLException sqlException) {
            throw new IllegalStateException("读取 journal_mode 失败", sqlException);
        }
    }

    private void initializeSchema() throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.execute(ENABLE_WAL_SQL);
        }

        connection.setAutoCommit(false);
        try (Statement statement = connection.createStatement()) {
            statement.execute(CREATE_TABLE_SQL);
            statement.execute(CREATE_IDX_PATH_SQL);
            statement.execute(CREATE_IDX_STATUS_SQL);
            connection.commit();
        } catch (SQLException sqlException) {
            connection.rollback();
            throw sqlException;
        } finally {
            connection.setAutoCommit(true);
        }
    }

    private DocumentRecord readRecord(ResultSet resultSet) throws SQLException {
        return new DocumentRecord(
                resultSet.getInt("doc_id"),
                Path.of(resultSet.getString("path")),
                resultSet.getLong("size_bytes"),
                DocumentStatus.valueOf(resultSet.getString("status")),
                resultSet.getString("reason"),
                resultSet.getInt("token_count")
        );
    }

    private String normalizePath(String rawPath) {
        if (rawPath == null) {
            return null;
        }
        return rawPath.replace('\\', '/');
    }

    private void rollbackQuietly(SQLException original) {
        try {
            connection.rollback();
        } catch (SQLException rollbackException) {
            original.addSuppressed(rollbackException);
        }
    }

    private void restoreAutoCommitQuietly(SQLException original) {
        try {
            connection.setAutoCommit(true);
        } catch (SQLException autoCommitException) {
            original.addSuppressed(autoCommitException);
        }
    }
}
