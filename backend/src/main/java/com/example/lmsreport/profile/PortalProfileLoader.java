package com.example.lmsreport.profile;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * classpath上の profiles/&lt;name&gt;.yml を読み込み、PortalProfileに変換するローダー。
 * 一度読み込んだプロファイルは名前ごとにキャッシュする。
 */
@Component
public class PortalProfileLoader {

    private static final Logger log = LoggerFactory.getLogger(PortalProfileLoader.class);
    private static final String DEFAULT_LOCATION = "classpath*:profiles/";

    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
    private final Gson gson = new GsonBuilder()
            .setFieldNamingPolicy(FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES)
            .create();
    private final Map<String, PortalProfile> cache = new ConcurrentHashMap<>();
    private final String location;

    public PortalProfileLoader() {
        this(DEFAULT_LOCATION);
    }

    PortalProfileLoader(String location) {
        this.location = location.endsWith("/") ? location : location + "/";
    }

    /**
     * プロファイルを名前で読み込みます。
     * @param profileName 拡張子を除いたファイル名
     * @throws IllegalArgumentException プロファイルが存在しない、空、または形式が不正な場合
     */
    public PortalProfile load(String profileName) {
        if (profileName == null || profileName.isBlank()) {
            throw new IllegalArgumentException("プロファイル名が指定されていません。");
        }
        return cache.computeIfAbsent(profileName, this::readProfile);
    }

    public List<String> listProfiles() {
        List<String> names = new ArrayList<>();
        try {
            for (Resource resource : resolver.getResources(location + "*.yml")) {
                String filename = resource.getFilename();
                if (filename != null) {
                    names.add(filename.substring(0, filename.length() - ".yml".length()));
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("プロファイル一覧の取得に失敗しました: " + location, e);
        }
        return names.stream().distinct().sorted().toList();
    }

    private PortalProfile readProfile(String profileName) {
        Resource resource = findResource(profileName);
        Object document;
        try (InputStream in = resource.getInputStream()) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            document = yaml.load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("プロファイルの読み込みに失敗しました: " + profileName, e);
        }
        if (!(document instanceof Map<?, ?> map) || map.isEmpty()) {
            throw new IllegalArgumentException("プロファイルが空です: " + profileName);
        }
        try {
            JsonElement tree = gson.toJsonTree(map);
            PortalProfile profile = gson.fromJson(tree, PortalProfile.class);
            log.info("プロファイル「{}」を読み込みました。", profileName);
            return profile;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("プロファイルの形式が不正です: " + profileName + " (" + e.getMessage() + ")", e);
        }
    }

    private Resource findResource(String profileName) {
        try {
            Resource[] resources = resolver.getResources(location + profileName + ".yml");
            for (Resource resource : resources) {
                if (resource.exists()) {
                    return resource;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("プロファイルの検索に失敗しました: " + profileName, e);
        }
        throw new IllegalArgumentException("プロファイルが見つかりません: " + location + profileName + ".yml");
    }
}
