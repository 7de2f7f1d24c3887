package org.dxworks.formframe.analyzer;

import org.dxworks.formframe.model.Analysis;

import java.nio.file.Path;
import java.util.List;

public interface FormAnalyzer {
    Analysis analyze(String formPath, List<Path> viewFiles);
}
