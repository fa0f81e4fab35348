package com.example.vidorchestrator.service;

import java.util.List;

/**
 * Source of the active content types (e.g. the prompt store).
 */
public interface ContentTypeProvider {

    List<String> loadContentTypes();
}
