package com.example.word2xml.config;

import com.example.word2xml.util.WordToXmlConverter;
import com.example.word2xml.util.style.LabelTable;
import com.example.word2xml.util.style.StyleMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

import java.io.IOException;
import java.io.InputStream;

/**
 * 转换引擎配置
 *
 * 样式映射表和语言标签表以数据文件提供，启动时加载；加载失败则启动失败
 */
@Slf4j
@Configuration
public class ConverterConfig {

    @Value("${word2xml.style-map:classpath:config/style-map.json}")
    private String styleMapLocation;

    @Value("${word2xml.labels:classpath:config/labels.json}")
    private String labelsLocation;

    @Value("${word2xml.pretty-print:false}")
    private boolean prettyPrint;

    @Bean
    public StyleMap styleMap(ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(styleMapLocation);
        try (InputStream in = resource.getInputStream()) {
            StyleMap map = StyleMap.load(in);
            log.info("样式映射表加载完成: {}, 段落规则 {} 条", styleMapLocation, map.getParagraphStyles().size());
            return map;
        } catch (IOException e) {
            throw new IllegalStateException("样式映射表加载失败: " + styleMapLocation, e);
        }
    }

    @Bean
    public LabelTable labelTable(ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(labelsLocation);
        try (InputStream in = resource.getInputStream()) {
            LabelTable labels = LabelTable.load(in);
            log.info("语言标签表加载完成: {}", labelsLocation);
            return labels;
        } catch (IOException e) {
            throw new IllegalStateException("语言标签表加载失败: " + labelsLocation, e);
        }
    }

    @Bean
    public WordToXmlConverter wordToXmlConverter(StyleMap styleMap, LabelTable labelTable) {
        return new WordToXmlConverter(styleMap, labelTable, prettyPrint);
    }
}
