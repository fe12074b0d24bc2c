package dev.shelfscan.inventory;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "inventory.firestore")
public class InventoryFirestoreProperties {

    private boolean enabled;
    private String projectId;
    private String categoriesCollection = "categories";
    private String subcategoriesCollection = "subcategories";
    private String productsCollection = "products";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getProjectId() {
        return projectId;
    }

    public void setProjectId(String projectId) {
        this.projectId = projectId;
    }

    public String getCategoriesCollection() {
        return categoriesCollection;
    }

    public void setCategoriesCollection(String categoriesCollection) {
        this.categoriesCollection = categoriesCollection;
    }

    public String getSubcategoriesCollection() {
        return subcategoriesCollection;
    }

    public void setSubcategoriesCollection(String subcategoriesCollection) {
        this.subcategoriesCollection = subcategoriesCollection;
    }

    public String getProductsCollection() {
        return productsCollection;
    }

    public void setProductsCollection(String productsCollection) {
        this.productsCollection = productsCollection;
    }
}
