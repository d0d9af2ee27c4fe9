package com.example.word2xml.service;

import com.example.word2xml.util.ConversionReport;
import com.example.word2xml.util.WordToXmlConverter;
import com.example.word2xml.util.wml.DocxPackageReader;
import com.example.word2xml.util.wml.dto.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * 文档转换服务
 *
 * 负责读写文件，转换本身由 WordToXmlConverter 完成。
 * 每个文档独立转换，一个文档失败不影响其它文档
 */
@Slf4j
@Service
public class ConversionService {

    private final WordToXmlConverter converter;

    @Value("${word2xml.output-suffix:.xml}")
    private String outputSuffix = ".xml";

    public ConversionService(WordToXmlConverter converter) {
        this.converter = converter;
    }

    /**
     * 转换文件
     *
     * @param input  .docx 文件，或已解包的 document.xml
     * @param output 输出文件；为 null 时写到输入文件旁边（扩展名替换为输出后缀）
     * @return 统计报告
     * @throws IOException 读取或写入失败
     */
    public ConversionReport convert(Path input, Path output) throws IOException {
        if (!Files.isRegularFile(input)) {
            throw new FileNotFoundException("输入文件不存在: " + input);
        }
        long start = System.currentTimeMillis();
        SourceDocument source;
        if (input.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".docx")) {
            source = DocxPackageReader.read(input);
        } else {
            String xml = new String(Files.readAllBytes(input), StandardCharsets.UTF_8);
            source = SourceDocument.ofDocumentXml(baseName(input), xml);
        }

        WordToXmlConverter.Result result = converter.convert(source);

        Path target = output != null ? output : defaultOutput(input);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null && !Files.exists(parent)) {
            Files.createDirectories(parent);
            log.info("创建输出目录: {}", parent);
        }
        Files.write(target, result.getXml().getBytes(StandardCharsets.UTF_8));
        log.info("转换输出: {} -> {}, 耗时 {} ms", input, target, System.currentTimeMillis() - start);
        return result.getReport();
    }

    /**
     * 内存转换：传入 document.xml 文本，返回输出 XML 和报告
     */
    public WordToXmlConverter.Result convertXml(String name, String documentXml) {
        return converter.convert(SourceDocument.ofDocumentXml(name, documentXml));
    }

    private Path defaultOutput(Path input) {
        Path dir = input.toAbsolutePath().getParent();
        String name = baseName(input) + outputSuffix;
        return dir == null ? Path.of(name) : dir.resolve(name);
    }

    private static String baseName(Path path) {
        String name = path.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
