package com.corpusindex.config;

/**
 * 全局常量定义
 *
 * 包含存储格式魔数、流水线默认参数与产物命名规则
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 存储格式魔数 ====================
    /** 桶文件魔数 "CXBK" */
    public static final int BUCKET_MAGIC = 0x4358424B;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;

    // ==================== 产物命名 ====================
    /** 桶文件名前缀 */
    public static final String BUCKET_FILE_PREFIX = "bucket-";
    /** 桶文件扩展名 */
    public static final String BUCKET_FILE_SUFFIX = ".bkt";
    /** 写入中的临时文件扩展名 */
    public static final String TEMP_FILE_SUFFIX = ".tmp";
    /** 索引清单文件 */
    public static final String MANIFEST_FILE_NAME = "manifest.json";
    /** 文档目录数据库 */
    public static final String CATALOG_FILE_NAME = "documents.db";

    // ==================== 文档参数 ====================
    /** 第一个文档 ID，枚举时单调递增分配 */
    public static final int FIRST_DOC_ID = 1;
    /** 每合并多少个文档输出一次进度日志 */
    public static final int PROGRESS_LOG_INTERVAL = 100;

    // ==================== 流水线参数 ====================
    /** 默认分词线程数 */
    public static final int DEFAULT_WORKER_THREADS = Runtime.getRuntime().availableProcessors();
    /** 分词线程数安全上限 */
    public static final int MAX_WORKER_THREADS = 64;
    /** 默认通道容量 */
    public static final int DEFAULT_CHANNEL_CAPACITY = 64;
    /** 通道阻塞时检查取消信号的间隔（毫秒） */
    public static final long CHANNEL_POLL_MILLIS = 50L;
    /** 失败后等待工作线程退出的宽限时间（毫秒） */
    public static final long SHUTDOWN_GRACE_MILLIS = 30_000L;

    // ==================== 分桶与落盘参数 ====================
    /** 默认分桶前缀长度（码点数） */
    public static final int DEFAULT_BUCKET_PREFIX_LENGTH = 1;
    /** 桶落盘最大尝试次数 */
    public static final int DEFAULT_FLUSH_MAX_ATTEMPTS = 3;
    /** 桶落盘重试退避（毫秒） */
    public static final long DEFAULT_FLUSH_RETRY_BACKOFF_MILLIS = 100L;

    // ==================== 溢写参数 ====================
    /** 默认溢写阈值（常驻倒排项数），0 表示不溢写 */
    public static final long DEFAULT_SPILL_THRESHOLD_POSTINGS = 2_000_000L;
    /** 输出目录下的溢写子目录 */
    public static final String SPILL_DIR_NAME = "spill";
    /** 溢写段文件名前缀 */
    public static final String RUN_FILE_PREFIX = "run-";
    /** 单次归并最多同时打开的溢写段数 */
    public static final int MAX_MERGE_FAN_IN = 8;

    // ==================== 分词参数 ====================
    /** 默认最短词长 */
    public static final int DEFAULT_MIN_TERM_LENGTH = 1;
}
