package dev.shelfscan.inventory.web;

import dev.shelfscan.catalog.Subcategory;
import dev.shelfscan.inventory.categorization.CategorizationOutcome;
import dev.shelfscan.inventory.categorization.CategorizationService;
import dev.shelfscan.inventory.categorization.CategoryCatalog;
import dev.shelfscan.inventory.categorization.ProductInput;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(path = "/api/products/categorize", produces = MediaType.APPLICATION_JSON_VALUE)
public class CategorizationController {

    private static final Logger LOGGER = LoggerFactory.getLogger(CategorizationController.class);

    private final CategorizationService categorizationService;

    public CategorizationController(CategorizationService categorizationService) {
        this.categorizationService = categorizationService;
    }

    /**
     * Categorize products, creating confidently suggested subcategories along the way.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ApiResponse<CategorizationOutcome> categorize(@RequestBody CategorizeRequest request) {
        CategorizeRequest body = request == null ? new CategorizeRequest(null, null) : request;
        LOGGER.info("Categorization requested for {} products",
            body.products() == null ? 0 : body.products().size());
        return ApiResponse.ok(categorizationService.categorize(body.products(), body.batch()));
    }

    @GetMapping("/categories")
    public ApiResponse<CategoryCatalog> listCategories() {
        return ApiResponse.ok(categorizationService.catalog());
    }

    @PostMapping(path = "/subcategories", consumes = MediaType.APPLICATION_JSON_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public ApiResponse<Subcategory> addSubcategory(@RequestBody AddSubcategoryRequest request) {
        AddSubcategoryRequest body = request == null ? new AddSubcategoryRequest(null, null) : request;
        return ApiResponse.ok(categorizationService.addSubcategory(body.name(), body.categoryId()));
    }

    public record CategorizeRequest(List<ProductInput> products, Boolean batch) { }

    public record AddSubcategoryRequest(String name, String categoryId) { }
}
