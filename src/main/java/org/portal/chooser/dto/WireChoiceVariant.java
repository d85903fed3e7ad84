package org.portal.chooser.dto;

/**
 * @param id    候选值 id
 * @param label 展示文本
 */
public record WireChoiceVariant(String id, String label) {
}
