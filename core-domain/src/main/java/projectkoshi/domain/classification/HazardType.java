package projectkoshi.domain.classification;

public enum HazardType {
    ROCKFALL,   // Susceptibilidad a desprendimientos de rocas
    GLOF        // Riesgo de desbordamiento de lago glaciar (Glacial Lake Outburst Flood)
}
