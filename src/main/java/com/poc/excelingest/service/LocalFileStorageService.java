package com.poc.excelingest.service;

import com.poc.excelingest.exception.ErrorCode;
import com.poc.excelingest.exception.FileException;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.Map;

@Service
public class LocalFileStorageService implements FileStorageService {

    private final Path root;

    public LocalFileStorageService(@Value("${excel.storage.path:./output/}") String storagePath) {
        this.root = Paths.get(storagePath).toAbsolutePath().normalize();
    }

    @Override
    public Path saveFile(byte[] content, String fileName) throws IOException {
        Path path = resolve(fileName);
        Files.createDirectories(path.getParent());
        Files.write(path, content);
        return path;
    }

    @Override
    public byte[] loadFile(String fileName) throws IOException {
        return Files.readAllBytes(resolve(fileName));
    }

    @Override
    public Path moveFile(String fileName, String targetName) throws IOException {
        Path source = resolve(fileName);
        Path target = resolve(targetName);
        Files.createDirectories(target.getParent());
        return Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }

    private Path resolve(String fileName) {
        Path path = root.resolve(fileName).normalize();
        if (!path.startsWith(root)) {
            throw new FileException("File name escapes the storage directory: " + fileName,
                    ErrorCode.FILE_ACCESS_DENIED, Map.of("file_name", fileName));
        }
        return path;
    }
}
