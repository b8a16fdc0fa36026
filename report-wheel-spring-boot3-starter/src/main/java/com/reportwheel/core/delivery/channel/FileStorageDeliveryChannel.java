package com.reportwheel.core.delivery.channel;

import com.reportwheel.core.spi.DeliveryChannel;
import com.reportwheel.exception.ChannelConfigException;
import com.reportwheel.exception.DeliveryFailedException;
import com.reportwheel.model.DeliveryContext;
import com.reportwheel.model.DeliveryReceipt;
import com.reportwheel.model.ReportArtifact;
import com.reportwheel.model.enums.DeliveryMethodType;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;

/**
 * 写入目录; overwrite=false 且同名文件已存在时以执行id区分文件名
 */
public class FileStorageDeliveryChannel implements DeliveryChannel {

    @Override
    public DeliveryMethodType type() {
        return DeliveryMethodType.FILE_STORAGE;
    }

    @Override
    public void validate(Map<String, Object> config) throws ChannelConfigException {
        directory(config);
    }

    @Override
    public String recipient(Map<String, Object> config) {
        return ChannelConfigs.str(config, "path");
    }

    @Override
    public DeliveryReceipt deliver(Map<String, Object> config, ReportArtifact artifact, DeliveryContext ctx) throws Exception {
        Path dir = directory(config);
        boolean overwrite = ChannelConfigs.bool(config, "overwrite", false);
        String fileName = artifact.getFileName() == null ? ctx.getExecutionId() + ".report" : artifact.getFileName();
        Path target = dir.resolve(fileName);
        if (!overwrite && Files.exists(target)) {
            target = dir.resolve(withSuffix(fileName, ctx.getExecutionId()));
        }
        try {
            Files.createDirectories(dir);
            Path tmp = Files.createTempFile(dir, ".report-", ".part");
            try {
                Files.write(tmp, artifact.getContent() == null ? new byte[0] : artifact.getContent());
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new DeliveryFailedException("Failed to write " + target + ": " + e.getMessage(), true, e);
        }
        return DeliveryReceipt.of("path", target.toAbsolutePath().toString()).with("bytes", artifact.size());
    }

    private static Path directory(Map<String, Object> config) {
        String path = ChannelConfigs.required(config, "path");
        try {
            return Paths.get(path);
        } catch (InvalidPathException e) {
            throw new ChannelConfigException("'path' is not a valid path: " + path);
        }
    }

    static String withSuffix(String fileName, String suffix) {
        int dot = fileName.lastIndexOf('.');
        if (dot <= 0) {
            return fileName + "-" + suffix;
        }
        return fileName.substring(0, dot) + "-" + suffix + fileName.substring(dot);
    }
}
