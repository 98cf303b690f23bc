package dev.zzpscanner.business;

/** Projection for grouped counts such as businesses per country or per city. */
public interface LabelCount {

  String getLabel();

  long getTotal();
}
