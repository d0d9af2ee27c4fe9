package com.example.word2xml.controller;

import com.example.word2xml.service.ConversionService;
import com.example.word2xml.util.ConversionReport;
import com.example.word2xml.util.WordToXmlConverter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Word 转 XML 控制器
 *
 * 只接受服务器本地路径，不处理上传
 */
@Slf4j
@RestController
@RequestMapping("/api/word2xml")
public class ConversionController {

    @Autowired
    private ConversionService conversionService;

    /**
     * 转换服务器上的文件
     *
     * @param request {"input": ".../chapter.docx", "output": ".../chapter.xml"}，output 可省略
     * @return 统计报告
     */
    @PostMapping("/convert")
    public ResponseEntity<Map<String, Object>> convert(@RequestBody Map<String, String> request) {
        Map<String, Object> result = new HashMap<>();

        String input = request.get("input");
        if (input == null || input.trim().isEmpty()) {
            result.put("success", false);
            result.put("message", "input 不能为空");
            return ResponseEntity.badRequest().body(result);
        }
        String output = request.get("output");

        try {
            log.info("转换请求: input={}, output={}", input, output);
            Path outputPath = output == null || output.trim().isEmpty() ? null : Paths.get(output.trim());
            ConversionReport report = conversionService.convert(Paths.get(input.trim()), outputPath);

            result.put("success", true);
            result.put("message", "转换成功");
            result.put("report", report);
            return ResponseEntity.ok(result);

        } catch (IOException e) {
            log.error("转换失败: {}", input, e);
            result.put("success", false);
            result.put("message", "转换失败: " + e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(result);
        }
    }

    /**
     * 直接转换 document.xml 文本，返回出版 XML
     */
    @PostMapping(value = "/convert-xml", produces = MediaType.APPLICATION_XML_VALUE)
    public ResponseEntity<String> convertXml(@RequestBody String documentXml,
                                             @RequestParam(value = "name", required = false, defaultValue = "document") String name) {
        if (documentXml == null || documentXml.trim().isEmpty()) {
            return ResponseEntity.badRequest().body("<error>document.xml 不能为空</error>");
        }
        WordToXmlConverter.Result result = conversionService.convertXml(name, documentXml);
        log.info("转换 document.xml: {}, 未解析引用 {} 个", name, result.getReport().getUnresolvedCitations().size());
        return ResponseEntity.ok(result.getXml());
    }
}
