package marouter.placement.model;

/**
 * Catalogued model with the VRAM it usually needs.
 */
public record ModelProfile(String name, double suggestedMinVramGb, Category category) {

    public enum Category {
        LLM,
        DIFFUSION,
        OTHER
    }
}
