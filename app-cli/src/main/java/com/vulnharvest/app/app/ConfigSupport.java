package com.vulnharvest.app.app;

import com.vulnharvest.core.model.CollectorConfig;
import com.vulnharvest.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/** 설정 파일 로드 + 환경변수 덮어쓰기 */
public final class ConfigSupport {
    private ConfigSupport() {}

    private static final Logger LOG = LoggerFactory.getLogger(ConfigSupport.class);

    public static final String ENV_API_KEY = "ALGOLIA_API_KEY";
    public static final String ENV_APP_ID  = "ALGOLIA_APPLICATION_ID";

    /** 파일이 없으면 기본값. 있는데 읽지 못하면 IOException */
    public static CollectorConfig load(Path file) throws IOException {
        if (file == null || !Files.exists(file)) {
            LOG.info("Config {} not found, using defaults", file);
            return CollectorConfig.defaults();
        }
        return YamlConfigLoader.load(file);
    }

    /** 비어 있지 않은 환경변수만 반영 */
    public static CollectorConfig applyEnv(CollectorConfig cfg, Map<String, String> env) {
        if (env == null) return cfg;
        String key = env.get(ENV_API_KEY);
        if (key != null && !key.isBlank()) cfg.setApiKey(key.trim());
        String app = env.get(ENV_APP_ID);
        if (app != null && !app.isBlank()) cfg.setApplicationId(app.trim());
        return cfg;
    }
}
