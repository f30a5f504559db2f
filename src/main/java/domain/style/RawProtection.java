package domain.style;

public record RawProtection(Boolean locked, Boolean hidden) {
}
