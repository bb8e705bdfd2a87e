package io.mersel.services.xbrl.application.models.xbrl;

/**
 * Sunum ağacındaki tek düğüm.
 *
 * @param name   Kavram adı
 * @param order  Kardeşler arası sıra
 * @param parent Üst kavram adı, kök düğümde {@code null}
 */
public record PresentationNode(String name, double order, String parent) {
}
