package projectkoshi.analysis.i;

import projectkoshi.domain.raster.Raster;
import projectkoshi.domain.terrain.GlacierProxies;
import projectkoshi.domain.terrain.SlopeAspect;

public interface ITerrainAnalyzer extends IAnalysisComponent {

    SlopeAspect deriveSlopeAspect(Raster dem);

    GlacierProxies estimateThickness(Raster dem, Raster slope, float snowlineElevation, float velocityFactor);
}
