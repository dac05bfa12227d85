package com.weatherdecision.scoring.controller;

import com.weatherdecision.common.catalog.IndexCatalog;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/catalog")
public class CatalogController {

    private final IndexCatalog catalog;

    public CatalogController(IndexCatalog catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<IndexDescriptor> catalog() {
        return catalog.all().stream().map(IndexDescriptor::from).toList();
    }
}
