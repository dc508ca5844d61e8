package io.github.yok.schedlink.core;

import io.github.yok.schedlink.config.ConnectionConfig;
import io.github.yok.schedlink.db.DestinationTables;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.UUID;
import org.dbunit.database.DatabaseConfig;
import org.dbunit.database.DatabaseConnection;
import org.dbunit.dataset.ITable;
import org.dbunit.ext.h2.H2DataTypeFactory;

/**
 * H2 (PostgreSQL モード) をロード先 DB として使うテストの支援ユーティリティです。
 *
 * <ul>
 * <li>接続情報：テストごとに一意なインメモリ DB を払い出す</li>
 * <li>検証：DBUnit のクエリテーブルで投入結果を取得する</li>
 * <li>データ：FlatAppointmentRecord のビルダー既定値を提供する</li>
 * </ul>
 */
final class H2DestinationSupport {

    private H2DestinationSupport() {}

    /**
     * 一意なインメモリ DB の接続情報を生成します。接続がすべて閉じても DB は破棄されません。
     *
     * @param prefix DB 名の接頭辞
     * @return 接続情報
     */
    static ConnectionConfig.Entry newEntry(String prefix) {
        ConnectionConfig.Entry entry = new ConnectionConfig.Entry();
        entry.setId(prefix);
        entry.setUrl("jdbc:h2:mem:" + prefix + "_" + UUID.randomUUID().toString().replace("-", "")
                + ";MODE=PostgreSQL;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH"
                + ";DB_CLOSE_DELAY=-1");
        entry.setUser("sa");
        entry.setPassword("");
        entry.setDriverClass("org.h2.Driver");
        return entry;
    }

    /**
     * 接続情報から destination のみを持つ ConnectionConfig を生成します。
     *
     * @param destination ロード先接続情報
     * @return ConnectionConfig
     */
    static ConnectionConfig destinationConfig(ConnectionConfig.Entry destination) {
        ConnectionConfig config = new ConnectionConfig();
        config.setDestination(destination);
        return config;
    }

    /**
     * JDBC 接続を開きます。
     *
     * @param entry 接続情報
     * @return JDBC コネクション
     * @throws SQLException 接続に失敗した場合
     */
    static Connection open(ConnectionConfig.Entry entry) throws SQLException {
        return DriverManager.getConnection(entry.getUrl(), entry.getUser(), entry.getPassword());
    }

    /**
     * ロード先テーブルを作成します（自動コミット）。
     *
     * @param conn JDBC コネクション
     * @throws SQLException DDL に失敗した場合
     */
    static void createTables(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String ddl : DestinationTables.DDL) {
                st.execute(ddl);
            }
        }
    }

    /**
     * テーブル件数を返します。
     *
     * @param conn JDBC コネクション
     * @param table テーブル名
     * @return 件数
     * @throws SQLException 取得に失敗した場合
     */
    static int count(Connection conn, String table) throws SQLException {
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT COUNT(*) FROM " + table)) {
            rs.next();
            return rs.getInt(1);
        }
    }

    /**
     * テーブルが存在するかを返します。
     *
     * @param conn JDBC コネクション
     * @param table テーブル名（小文字）
     * @return 存在する場合 true
     * @throws SQLException 取得に失敗した場合
     */
    static boolean tableExists(Connection conn, String table) throws SQLException {
        try (ResultSet rs = conn.getMetaData().getTables(null, null, table, null)) {
            return rs.next();
        }
    }

    /**
     * DBUnit のクエリテーブルとして SELECT 結果を取得します。
     *
     * <p>
     * DBUnit の DatabaseConnection は close すると元の JDBC 接続も閉じるため、ここでは閉じません。
     * </p>
     *
     * @param conn JDBC コネクション
     * @param sql SELECT 文
     * @return 結果テーブル
     * @throws Exception 取得に失敗した場合
     */
    static ITable query(Connection conn, String sql) throws Exception {
        DatabaseConnection dbConn = new DatabaseConnection(conn);
        dbConn.getConfig().setProperty(DatabaseConfig.PROPERTY_DATATYPE_FACTORY,
                new H2DataTypeFactory());
        return dbConn.createQueryTable("result", sql);
    }

    /**
     * 数値列の値を long で返します。
     *
     * @param table 結果テーブル
     * @param row 行番号
     * @param column 列名
     * @return 値
     * @throws Exception 取得に失敗した場合
     */
    static long longValue(ITable table, int row, String column) throws Exception {
        return ((Number) table.getValue(row, column)).longValue();
    }

    /**
     * 既定値を設定済みのレコードビルダーを返します。
     *
     * @param document 患者の身分証番号
     * @param services サービス名スロット
     * @return ビルダー
     */
    static FlatAppointmentRecord.FlatAppointmentRecordBuilder record(String document,
            String... services) {
        return FlatAppointmentRecord.builder().sourceId(1L).patientGivenName("Juan Carlos")
                .patientFamilyName("Benítez").patientDocument(document)
                .date(LocalDate.of(2025, 3, 10)).time(LocalTime.of(9, 30)).durationMinutes(20)
                .overbooked(false).status("Asignado")
                .createdAt(LocalDateTime.of(2025, 3, 1, 8, 15, 0)).createdBy("recep01")
                .serviceNames(Arrays.asList(services));
    }
}
