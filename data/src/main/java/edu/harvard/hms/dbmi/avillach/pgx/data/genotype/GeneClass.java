package edu.harvard.hms.dbmi.avillach.pgx.data.genotype;

public enum GeneClass {
	CYTOCHROME,
	ENZYME,
	TRANSPORTER
}
