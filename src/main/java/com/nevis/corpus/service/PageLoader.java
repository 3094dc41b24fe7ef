package com.nevis.corpus.service;

import com.nevis.corpus.model.Page;

import java.nio.file.Path;
import java.util.List;

public interface PageLoader {
    List<Page> loadPages(Path root, Path translationDir);
}
